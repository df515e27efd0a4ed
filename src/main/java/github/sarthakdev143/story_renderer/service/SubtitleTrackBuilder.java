package github.sarthakdev143.story_renderer.service;

import github.sarthakdev143.story_renderer.model.Orientation;
import github.sarthakdev143.story_renderer.model.composition.PreparedScene;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

public interface SubtitleTrackBuilder {

    /**
     * Writes one subtitle file covering all scenes in the given order, or returns empty when no
     * caption event would be produced.
     */
    Optional<Path> buildSubtitleFile(
            String trackId,
            List<PreparedScene> orderedScenes,
            String styleName,
            Orientation orientation) throws IOException;
}
