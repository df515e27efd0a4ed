package github.sarthakdev143.story_renderer.model;

import java.nio.file.Path;

public record NarrationAudio(
        Path audioPath,
        double durationSeconds) {
}
