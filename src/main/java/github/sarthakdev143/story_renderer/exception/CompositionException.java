package github.sarthakdev143.story_renderer.exception;

/**
 * The media tool exited unsuccessfully. The tool's own output is kept verbatim.
 */
public class CompositionException extends RenderException {

    private final String stage;
    private final int exitCode;
    private final String toolOutput;

    public CompositionException(String stage, int exitCode, String toolOutput) {
        super("FFmpeg failed during stage " + stage + " with exit code " + exitCode + ". Output: " + toolOutput);
        this.stage = stage;
        this.exitCode = exitCode;
        this.toolOutput = toolOutput;
    }

    public CompositionException(String message) {
        super(message);
        this.stage = null;
        this.exitCode = -1;
        this.toolOutput = null;
    }

    public String getStage() {
        return stage;
    }

    public int getExitCode() {
        return exitCode;
    }

    public String getToolOutput() {
        return toolOutput;
    }
}
