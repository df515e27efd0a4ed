package github.sarthakdev143.story_renderer.service;

import github.sarthakdev143.story_renderer.model.CaptionWord;

import java.nio.file.Path;
import java.util.List;

/**
 * Best-effort word alignment. Callers treat any exception as "no words".
 */
public interface CaptionTimer {

    List<CaptionWord> transcribeWordTimings(Path audioPath, String referenceText);
}
