package github.sarthakdev143.story_renderer.model.composition;

import github.sarthakdev143.story_renderer.dto.CaptionWordRequest;
import github.sarthakdev143.story_renderer.dto.RenderSceneRequest;
import github.sarthakdev143.story_renderer.model.CaptionWord;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Job-private copy of a submitted scene, enriched with narration audio and caption words while the
 * job runs. The submitted request itself is never mutated.
 */
public record PreparedScene(
        int submissionIndex,
        String sceneId,
        double sortKey,
        String text,
        String voice,
        String mediaUrl,
        Double declaredDuration,
        Path audioPath,
        Double audioDuration,
        List<CaptionWord> captions) {

    private static final double MISSING_END_SECONDS = 0.4;

    public PreparedScene {
        captions = captions == null ? List.of() : List.copyOf(captions);
    }

    public static PreparedScene from(int submissionIndex, RenderSceneRequest scene, String defaultVoice) {
        String voice = scene.ttsVoice() != null && !scene.ttsVoice().isBlank() ? scene.ttsVoice() : defaultVoice;
        Double declaredDuration = scene.audioDuration() != null ? scene.audioDuration() : scene.duration();
        return new PreparedScene(
                submissionIndex,
                scene.id(),
                resolveSortKey(scene.order(), submissionIndex),
                scene.narrationText(),
                voice,
                scene.mediaUrl(),
                declaredDuration,
                null,
                null,
                normalizeCaptionRequests(scene.captions()));
    }

    public PreparedScene withNarration(Path audioPath, double audioDuration) {
        return new PreparedScene(
                submissionIndex,
                sceneId,
                sortKey,
                text,
                voice,
                mediaUrl,
                declaredDuration,
                audioPath,
                audioDuration,
                captions);
    }

    public PreparedScene withCaptions(List<CaptionWord> captions) {
        return new PreparedScene(
                submissionIndex,
                sceneId,
                sortKey,
                text,
                voice,
                mediaUrl,
                declaredDuration,
                audioPath,
                audioDuration,
                captions);
    }

    /**
     * Audio duration wins over the declared one; {@code fallbackSeconds} applies when neither is known.
     */
    public double effectiveDuration(double fallbackSeconds) {
        if (audioDuration != null && audioDuration > 0) {
            return audioDuration;
        }
        if (declaredDuration != null && declaredDuration > 0) {
            return declaredDuration;
        }
        return fallbackSeconds;
    }

    public Double knownDuration() {
        return audioDuration != null ? audioDuration : declaredDuration;
    }

    static double resolveSortKey(Object order, int submissionIndex) {
        if (order instanceof Number number) {
            double value = number.doubleValue();
            return Double.isFinite(value) ? value : submissionIndex;
        }
        if (order instanceof String value && !value.isBlank()) {
            try {
                double parsed = Double.parseDouble(value.trim());
                return Double.isFinite(parsed) ? parsed : submissionIndex;
            } catch (NumberFormatException ignored) {
                return submissionIndex;
            }
        }
        return submissionIndex;
    }

    /**
     * Missing starts continue from the previous word, missing or non-increasing ends get a short default span.
     */
    public static List<CaptionWord> normalizeCaptionRequests(List<CaptionWordRequest> requests) {
        List<CaptionWord> words = new ArrayList<>();
        if (requests == null) {
            return words;
        }

        Double previousEnd = null;
        for (CaptionWordRequest request : requests) {
            if (request == null || request.text() == null || request.text().isBlank()) {
                continue;
            }
            double start = request.start() != null
                    ? CaptionWord.round3(request.start())
                    : (previousEnd != null ? previousEnd : 0.0);
            CaptionWord word = normalizedWord(request.text(), start, request.end());
            previousEnd = word.end();
            words.add(word);
        }

        words.sort(Comparator.comparingDouble(CaptionWord::start));
        return words;
    }

    /**
     * Same rules for words coming back from a caption timer: blank words are dropped, times are rounded
     * and a non-increasing end gets the default span.
     */
    public static List<CaptionWord> normalizeCaptionWords(List<CaptionWord> timed) {
        List<CaptionWord> words = new ArrayList<>();
        if (timed == null) {
            return words;
        }
        for (CaptionWord word : timed) {
            if (word == null || word.text() == null || word.text().isBlank()) {
                continue;
            }
            words.add(normalizedWord(word.text(), CaptionWord.round3(word.start()), word.end()));
        }
        words.sort(Comparator.comparingDouble(CaptionWord::start));
        return words;
    }

    private static CaptionWord normalizedWord(String text, double start, Double rawEnd) {
        double end = rawEnd != null ? CaptionWord.round3(rawEnd) : start + MISSING_END_SECONDS;
        if (end <= start) {
            end = start + MISSING_END_SECONDS;
        }
        return new CaptionWord(text.trim(), start, CaptionWord.round3(end));
    }
}
