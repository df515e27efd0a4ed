package github.sarthakdev143.story_renderer.integration.narration;

import github.sarthakdev143.story_renderer.model.CaptionWord;
import github.sarthakdev143.story_renderer.service.CaptionTimer;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;

/**
 * No speech alignment backend: every scene falls back to submitted or evenly spaced captions.
 */
@Component
public class NoopCaptionTimer implements CaptionTimer {

    @Override
    public List<CaptionWord> transcribeWordTimings(Path audioPath, String referenceText) {
        return List.of();
    }
}
