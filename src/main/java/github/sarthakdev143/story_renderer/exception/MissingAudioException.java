package github.sarthakdev143.story_renderer.exception;

import java.nio.file.Path;

public class MissingAudioException extends RenderException {

    public MissingAudioException(String sceneLabel, Path audioPath) {
        super("Audio track missing for scene " + sceneLabel + (audioPath == null ? "" : " at " + audioPath));
    }
}
