package github.sarthakdev143.story_renderer.exception;

public class CaptionTimingException extends RenderException {

    public CaptionTimingException(String message) {
        super(message);
    }

    public CaptionTimingException(String message, Throwable cause) {
        super(message, cause);
    }
}
