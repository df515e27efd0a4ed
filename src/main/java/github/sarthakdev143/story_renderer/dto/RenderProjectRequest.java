package github.sarthakdev143.story_renderer.dto;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public record RenderProjectRequest(
        String id,
        String format,
        String voiceModel,
        String captionStyle,
        List<RenderSceneRequest> scenes) {

    public RenderProjectRequest {
        // null entries survive so validation can report them by position
        scenes = scenes == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(scenes));
    }
}
