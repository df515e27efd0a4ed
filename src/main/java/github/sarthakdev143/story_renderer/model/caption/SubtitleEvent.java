package github.sarthakdev143.story_renderer.model.caption;

public record SubtitleEvent(
        long startMs,
        long endMs,
        String text) {
}
