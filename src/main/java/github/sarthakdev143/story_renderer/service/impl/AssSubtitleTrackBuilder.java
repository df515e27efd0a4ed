package github.sarthakdev143.story_renderer.service.impl;

import github.sarthakdev143.story_renderer.config.RenderProperties;
import github.sarthakdev143.story_renderer.model.CaptionWord;
import github.sarthakdev143.story_renderer.model.Orientation;
import github.sarthakdev143.story_renderer.model.caption.CaptionStyle;
import github.sarthakdev143.story_renderer.model.caption.CaptionStyleMode;
import github.sarthakdev143.story_renderer.model.caption.CaptionStylePresets;
import github.sarthakdev143.story_renderer.model.caption.SubtitleEvent;
import github.sarthakdev143.story_renderer.model.caption.SubtitleTrack;
import github.sarthakdev143.story_renderer.model.composition.PreparedScene;
import github.sarthakdev143.story_renderer.service.SubtitleTrackBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Builds one Advanced SubStation Alpha track for a whole render. Per-scene caption times are shifted by
 * the running timeline offset so each scene's captions start where the previous scene ended.
 */
@Component
public class AssSubtitleTrackBuilder implements SubtitleTrackBuilder {

    private static final Logger logger = LoggerFactory.getLogger(AssSubtitleTrackBuilder.class);
    static final double FALLBACK_WORD_SECONDS = 0.4;
    static final double LINE_PAD_SECONDS = 0.05;
    private static final String NO_SPACE_BEFORE = ",.!?:;)]}»”′";

    private final Path outputDir;

    @Autowired
    public AssSubtitleTrackBuilder(RenderProperties properties) {
        this(properties.subtitleCacheDir());
    }

    AssSubtitleTrackBuilder(Path outputDir) {
        this.outputDir = outputDir;
    }

    @Override
    public Optional<Path> buildSubtitleFile(
            String trackId,
            List<PreparedScene> orderedScenes,
            String styleName,
            Orientation orientation) throws IOException {
        CaptionStyle style = CaptionStylePresets.resolve(styleName);
        if (styleName != null && !styleName.equals(style.displayName())) {
            logger.info("Resolved caption style '{}' to preset '{}'", styleName, style.displayName());
        }

        SubtitleTrack track = buildTrack(orderedScenes, style, orientation == null ? Orientation.LANDSCAPE : orientation);
        Path outputPath = outputDir.resolve(safeTrackId(trackId) + ".ass");
        if (track.isEmpty()) {
            logger.info("No caption events generated for track {}", trackId);
            Files.deleteIfExists(outputPath);
            return Optional.empty();
        }

        Files.createDirectories(outputDir);
        Path tempFile = Files.createTempFile(outputDir, "subtitles-", ".part");
        try {
            Files.writeString(tempFile, render(track), StandardCharsets.UTF_8);
            Files.move(tempFile, outputPath, StandardCopyOption.REPLACE_EXISTING);
        } finally {
            Files.deleteIfExists(tempFile);
        }

        logger.info(
                "Generated subtitle file {} with {} events using style {}",
                outputPath,
                track.events().size(),
                style.displayName());
        return Optional.of(outputPath);
    }

    SubtitleTrack buildTrack(List<PreparedScene> orderedScenes, CaptionStyle style, Orientation orientation) {
        EventRenderer renderer = rendererFor(style);
        List<SubtitleEvent> events = new ArrayList<>();
        double timelineOffset = 0.0;

        for (PreparedScene scene : orderedScenes) {
            List<CaptionWord> localWords = scene.captions().isEmpty()
                    ? fallbackWords(scene.text(), scene.knownDuration())
                    : scene.captions();

            List<CaptionWord> absoluteWords = new ArrayList<>(localWords.size());
            for (CaptionWord word : localWords) {
                absoluteWords.add(word.shift(timelineOffset));
            }
            renderer.render(absoluteWords, events);

            timelineOffset = CaptionWord.round3(timelineOffset + sceneDuration(scene.knownDuration(), localWords));
        }

        events.sort(Comparator.comparingLong(SubtitleEvent::startMs).thenComparingLong(SubtitleEvent::endMs));
        return new SubtitleTrack(style, orientation.width(), orientation.height(), events);
    }

    /**
     * Evenly spaced words over {@code durationSeconds}, or {@link #FALLBACK_WORD_SECONDS} per word when the
     * duration is unknown.
     */
    static List<CaptionWord> fallbackWords(String text, Double durationSeconds) {
        List<CaptionWord> words = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return words;
        }

        String[] tokens = text.trim().split("\\s+");
        double total = durationSeconds != null && durationSeconds > 0
                ? durationSeconds
                : tokens.length * FALLBACK_WORD_SECONDS;
        double slice = total / tokens.length;
        for (int index = 0; index < tokens.length; index++) {
            double start = CaptionWord.round3(index * slice);
            words.add(new CaptionWord(tokens[index], start, CaptionWord.round3(start + slice)));
        }
        return words;
    }

    static double sceneDuration(Double knownDuration, List<CaptionWord> localWords) {
        double lastEnd = 0.0;
        for (CaptionWord word : localWords) {
            lastEnd = Math.max(lastEnd, word.end());
        }
        double declared = knownDuration == null ? 0.0 : knownDuration;
        return Math.max(0.0, CaptionWord.round3(Math.max(declared, lastEnd)));
    }

    static List<List<CaptionWord>> groupIntoLines(List<CaptionWord> words, int maxWordsPerLine) {
        List<List<CaptionWord>> lines = new ArrayList<>();
        List<CaptionWord> current = new ArrayList<>();
        for (CaptionWord word : words) {
            current.add(word);
            String stripped = word.text() == null ? "" : word.text().strip();
            boolean sentenceEnd = stripped.endsWith(".") || stripped.endsWith("!") || stripped.endsWith("?");
            boolean clauseBreak = stripped.endsWith(";") || stripped.endsWith(":");
            if (current.size() >= maxWordsPerLine
                    || sentenceEnd
                    || (clauseBreak && current.size() >= maxWordsPerLine / 2)) {
                lines.add(current);
                current = new ArrayList<>();
            }
        }
        if (!current.isEmpty()) {
            lines.add(current);
        }
        return lines;
    }

    /**
     * Removes control characters and rewrites characters that would be read as ASS override syntax.
     */
    static String sanitize(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }

        StringBuilder cleaned = new StringBuilder(text.length());
        text.codePoints().forEach(codePoint -> {
            if (codePoint == '\n') {
                cleaned.append("\\N");
                return;
            }
            if (codePoint == '\r') {
                return;
            }
            if (codePoint != '\t' && isControlCategory(codePoint)) {
                return;
            }
            switch (codePoint) {
                case '\\' -> cleaned.append('/');
                case '{' -> cleaned.append('(');
                case '}' -> cleaned.append(')');
                default -> cleaned.appendCodePoint(codePoint);
            }
        });
        return cleaned.toString();
    }

    String render(SubtitleTrack track) {
        CaptionStyle style = track.style();
        StringBuilder ass = new StringBuilder();
        ass.append("[Script Info]\n")
                .append("; Generated by story-renderer\n")
                .append("ScriptType: v4.00+\n")
                .append("WrapStyle: 0\n")
                .append("ScaledBorderAndShadow: yes\n")
                .append("PlayResX: ").append(track.playResX()).append('\n')
                .append("PlayResY: ").append(track.playResY()).append('\n')
                .append('\n');

        ass.append("[V4+ Styles]\n")
                .append("Format: Name, Fontname, Fontsize, PrimaryColour, SecondaryColour, OutlineColour, BackColour, ")
                .append("Bold, Italic, Underline, StrikeOut, ScaleX, ScaleY, Spacing, Angle, BorderStyle, Outline, ")
                .append("Shadow, Alignment, MarginL, MarginR, MarginV, Encoding\n")
                .append("Style: ")
                .append(style.styleName()).append(',')
                .append(style.fontName()).append(',')
                .append(formatNumber(style.fontSize())).append(',')
                .append(colorOrDefault(style.primaryColor(), "&H00FFFFFF")).append(',')
                .append(colorOrDefault(style.secondaryColor(), "&H000000FF")).append(',')
                .append(colorOrDefault(style.outlineColor(), "&H00000000")).append(',')
                .append(colorOrDefault(style.backColor(), "&H00000000")).append(',')
                .append(style.bold() ? "-1" : "0").append(",0,0,0,100,100,")
                .append(formatNumber(style.spacing())).append(",0,")
                .append(style.borderStyle()).append(',')
                .append(formatNumber(style.outline())).append(',')
                .append(formatNumber(style.shadow())).append(',')
                .append(CaptionStyle.BOTTOM_CENTER_ALIGNMENT).append(',')
                .append(style.marginH()).append(',')
                .append(style.marginH()).append(',')
                .append(style.marginV()).append(",1\n")
                .append('\n');

        ass.append("[Events]\n")
                .append("Format: Layer, Start, End, Style, Name, MarginL, MarginR, MarginV, Effect, Text\n");
        for (SubtitleEvent event : track.events()) {
            ass.append("Dialogue: 0,")
                    .append(formatTimestamp(event.startMs())).append(',')
                    .append(formatTimestamp(event.endMs())).append(',')
                    .append(style.styleName())
                    .append(",,0,0,0,,")
                    .append(event.text())
                    .append('\n');
        }
        return ass.toString();
    }

    static String formatTimestamp(long millis) {
        long centiseconds = Math.max(0, millis) / 10;
        long hours = centiseconds / 360_000;
        long minutes = (centiseconds / 6_000) % 60;
        long seconds = (centiseconds / 100) % 60;
        return String.format(Locale.ROOT, "%d:%02d:%02d.%02d", hours, minutes, seconds, centiseconds % 100);
    }

    private EventRenderer rendererFor(CaptionStyle style) {
        if (style.mode() == CaptionStyleMode.WORD) {
            return new WordEventRenderer(style);
        }
        return style.karaoke() ? new KaraokeLineRenderer(style) : new PlainLineRenderer(style);
    }

    private static SubtitleEvent event(double startSeconds, double endSeconds, String text) {
        long startMs = Math.max(0, Math.round(startSeconds * 1000));
        long endMs = Math.round(endSeconds * 1000);
        if (endMs <= startMs) {
            endMs = startMs + 1;
        }
        return new SubtitleEvent(startMs, endMs, text);
    }

    private static double lineStart(List<CaptionWord> line) {
        return line.stream().mapToDouble(CaptionWord::start).min().orElse(0.0);
    }

    private static double lineEnd(List<CaptionWord> line) {
        return line.stream().mapToDouble(CaptionWord::end).max().orElse(0.0);
    }

    private static String transformToken(String text, CaptionStyle style) {
        String token = text == null ? "" : text;
        if (style.uppercase()) {
            token = token.toUpperCase(Locale.ROOT);
        }
        return sanitize(token);
    }

    private static boolean requiresSpace(String nextText) {
        if (nextText == null) {
            return false;
        }
        String stripped = nextText.strip();
        return !stripped.isEmpty() && NO_SPACE_BEFORE.indexOf(stripped.charAt(0)) < 0;
    }

    static String wrapWithTags(String text, List<String> tags) {
        if (text.isEmpty()) {
            return text;
        }
        StringBuilder joined = new StringBuilder();
        for (String tag : tags) {
            if (tag != null && tag.strip().startsWith("\\")) {
                joined.append(tag.strip());
            }
        }
        return joined.length() == 0 ? text : "{" + joined + "}" + text;
    }

    /**
     * {@code &HAABBGGRR} style colour to the {@code &HBBGGRR&} form override tags expect.
     */
    static String overrideColor(String value) {
        if (value == null) {
            return null;
        }
        String token = value.strip().toUpperCase(Locale.ROOT);
        if (!token.startsWith("&H") || token.length() == 2) {
            return null;
        }
        String hex = token.substring(2);
        if (hex.endsWith("&")) {
            hex = hex.substring(0, hex.length() - 1);
        }
        if (hex.length() < 6) {
            hex = "0".repeat(6 - hex.length()) + hex;
        }
        return "&H" + hex.substring(hex.length() - 6) + "&";
    }

    private static String colorOrDefault(String color, String fallback) {
        return color == null || color.isBlank() ? fallback : color;
    }

    private static String formatNumber(double value) {
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    private static boolean isControlCategory(int codePoint) {
        int type = Character.getType(codePoint);
        return type == Character.CONTROL
                || type == Character.FORMAT
                || type == Character.PRIVATE_USE
                || type == Character.SURROGATE
                || type == Character.UNASSIGNED;
    }

    private static String safeTrackId(String trackId) {
        String raw = trackId == null ? "project" : trackId;
        StringBuilder safe = new StringBuilder(raw.length());
        for (char ch : raw.toCharArray()) {
            safe.append(Character.isLetterOrDigit(ch) || ch == '-' || ch == '_' || ch == '.' ? ch : '_');
        }
        String trimmed = safe.toString().replaceAll("^_+|_+$", "");
        return trimmed.isEmpty() ? "project" : trimmed;
    }

    private interface EventRenderer {

        void render(List<CaptionWord> absoluteWords, List<SubtitleEvent> sink);
    }

    /**
     * One event per word. The colour cycle advances across scene boundaries.
     */
    private static final class WordEventRenderer implements EventRenderer {

        private final CaptionStyle style;
        private int wordIndex;

        private WordEventRenderer(CaptionStyle style) {
            this.style = style;
        }

        @Override
        public void render(List<CaptionWord> absoluteWords, List<SubtitleEvent> sink) {
            for (CaptionWord word : absoluteWords) {
                String text = transformToken(word.text(), style);
                if (text.isEmpty()) {
                    continue;
                }
                List<String> tags = new ArrayList<>(style.wordTags());
                if (!style.wordColorCycle().isEmpty()) {
                    String color = overrideColor(style.wordColorCycle().get(wordIndex % style.wordColorCycle().size()));
                    if (color != null) {
                        tags.add("\\1c" + color);
                    }
                }
                sink.add(event(word.start(), word.end(), wrapWithTags(text, tags)));
                wordIndex++;
            }
        }
    }

    private static final class PlainLineRenderer implements EventRenderer {

        private final CaptionStyle style;

        private PlainLineRenderer(CaptionStyle style) {
            this.style = style;
        }

        @Override
        public void render(List<CaptionWord> absoluteWords, List<SubtitleEvent> sink) {
            for (List<CaptionWord> line : groupIntoLines(absoluteWords, style.maxWordsPerLine())) {
                StringBuilder text = new StringBuilder();
                for (int index = 0; index < line.size(); index++) {
                    String token = transformToken(line.get(index).text(), style);
                    if (token.isEmpty()) {
                        continue;
                    }
                    text.append(token);
                    if (index + 1 < line.size() && requiresSpace(line.get(index + 1).text())) {
                        text.append(' ');
                    }
                }
                String payload = text.toString().strip();
                if (payload.isEmpty()) {
                    continue;
                }
                sink.add(event(
                        lineStart(line),
                        lineEnd(line) + LINE_PAD_SECONDS,
                        wrapWithTags(payload, style.lineTags())));
            }
        }
    }

    /**
     * One event per line with per-word {@code \k} reveal durations in centiseconds.
     */
    private static final class KaraokeLineRenderer implements EventRenderer {

        private final CaptionStyle style;

        private KaraokeLineRenderer(CaptionStyle style) {
            this.style = style;
        }

        @Override
        public void render(List<CaptionWord> absoluteWords, List<SubtitleEvent> sink) {
            for (List<CaptionWord> line : groupIntoLines(absoluteWords, style.maxWordsPerLine())) {
                StringBuilder text = new StringBuilder();
                for (int index = 0; index < line.size(); index++) {
                    CaptionWord word = line.get(index);
                    String token = transformToken(word.text(), style);
                    if (token.isEmpty()) {
                        continue;
                    }
                    long centiseconds = Math.max(1, Math.round(Math.max(word.end() - word.start(), 0.01) * 100));
                    text.append("{\\k").append(centiseconds).append('}').append(token);
                    if (index + 1 < line.size() && requiresSpace(line.get(index + 1).text())) {
                        text.append("\\h");
                    }
                }
                if (text.length() == 0) {
                    continue;
                }
                sink.add(event(
                        lineStart(line),
                        lineEnd(line),
                        wrapWithTags(text.toString(), style.lineTags())));
            }
        }
    }
}
