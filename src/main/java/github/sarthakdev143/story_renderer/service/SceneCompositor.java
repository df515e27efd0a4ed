package github.sarthakdev143.story_renderer.service;

import github.sarthakdev143.story_renderer.model.Orientation;

import java.io.IOException;
import java.nio.file.Path;

public interface SceneCompositor {

    /**
     * Renders one scene clip. {@code mediaPath} may be null, in which case a flat background is used.
     */
    Path buildSceneClip(
            Path mediaPath,
            Path audioPath,
            double durationSeconds,
            Orientation orientation,
            Path outputPath) throws IOException, InterruptedException;
}
