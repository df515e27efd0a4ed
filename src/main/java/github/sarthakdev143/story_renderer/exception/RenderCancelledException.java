package github.sarthakdev143.story_renderer.exception;

import github.sarthakdev143.story_renderer.model.RenderJobStatus;

/**
 * Control-flow signal for a deliberate stop. Never recorded as a failure.
 */
public class RenderCancelledException extends RenderException {

    private final RenderJobStatus targetStatus;

    public RenderCancelledException(RenderJobStatus targetStatus, String checkpoint) {
        super("Render stopped (" + targetStatus.toApiValue() + ") " + checkpoint);
        this.targetStatus = targetStatus;
    }

    public RenderJobStatus getTargetStatus() {
        return targetStatus;
    }
}
