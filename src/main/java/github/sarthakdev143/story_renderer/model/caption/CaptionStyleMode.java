package github.sarthakdev143.story_renderer.model.caption;

public enum CaptionStyleMode {
    WORD,
    LINE
}
