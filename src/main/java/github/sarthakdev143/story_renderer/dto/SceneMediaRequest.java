package github.sarthakdev143.story_renderer.dto;

public record SceneMediaRequest(
        String url) {
}
