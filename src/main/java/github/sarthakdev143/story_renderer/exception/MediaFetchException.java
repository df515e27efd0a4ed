package github.sarthakdev143.story_renderer.exception;

public class MediaFetchException extends RenderException {

    private final String url;

    public MediaFetchException(String url, Throwable cause) {
        super("Media download failed for " + url, cause);
        this.url = url;
    }

    public MediaFetchException(String url, String reason) {
        super("Media download failed for " + url + ": " + reason);
        this.url = url;
    }

    public String getUrl() {
        return url;
    }
}
