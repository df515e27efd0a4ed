package github.sarthakdev143.story_renderer.model.composition;

import github.sarthakdev143.story_renderer.dto.RenderSceneRequest;
import github.sarthakdev143.story_renderer.model.Orientation;

import java.util.List;

/**
 * Validated render input. {@code projectId} is null when the client did not name the project.
 */
public record RenderProjectPlan(
        String projectId,
        Orientation orientation,
        String voice,
        String captionStyle,
        List<RenderSceneRequest> scenes) {

    public RenderProjectPlan {
        scenes = scenes == null ? List.of() : List.copyOf(scenes);
    }
}
