package github.sarthakdev143.story_renderer.service;

import github.sarthakdev143.story_renderer.exception.RenderCancelledException;
import github.sarthakdev143.story_renderer.model.RenderJobStatus;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Cooperative stop signal for one job. Stages poll it between units of work; nothing is interrupted.
 */
public final class RenderCancellationToken {

    private final AtomicReference<RenderJobStatus> requested = new AtomicReference<>();

    public void requestStop(RenderJobStatus targetStatus) {
        if (targetStatus == null || !targetStatus.isStopTarget()) {
            throw new IllegalArgumentException("Stop target must be cancelled or paused, got " + targetStatus);
        }
        requested.set(targetStatus);
    }

    public boolean isStopRequested() {
        return requested.get() != null;
    }

    public RenderJobStatus requestedStatus() {
        return requested.get();
    }

    public void throwIfStopRequested(String checkpoint) {
        RenderJobStatus target = requested.get();
        if (target != null) {
            throw new RenderCancelledException(target, checkpoint);
        }
    }
}
