package github.sarthakdev143.story_renderer.dto;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One scene as submitted. {@code order} is kept raw because clients send numbers, numeric strings
 * or nothing at all.
 */
public record RenderSceneRequest(
        String id,
        Object order,
        String script,
        String text,
        String ttsVoice,
        SceneMediaRequest media,
        List<String> keywords,
        Double audioDuration,
        Double duration,
        List<CaptionWordRequest> captions) {

    public RenderSceneRequest {
        keywords = keywords == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(keywords));
        captions = captions == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(captions));
    }

    public String narrationText() {
        if (script != null && !script.isBlank()) {
            return script;
        }
        return text == null ? "" : text;
    }

    public String mediaUrl() {
        if (media == null || media.url() == null || media.url().isBlank()) {
            return null;
        }
        return media.url().trim();
    }
}
