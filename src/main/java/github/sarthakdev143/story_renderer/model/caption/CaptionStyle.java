package github.sarthakdev143.story_renderer.model.caption;

import java.util.List;

/**
 * Rendering rules of one caption preset. Colours use the ASS {@code &HAABBGGRR} notation.
 */
public record CaptionStyle(
        String displayName,
        String styleName,
        CaptionStyleMode mode,
        String fontName,
        double fontSize,
        String primaryColor,
        String secondaryColor,
        String outlineColor,
        String backColor,
        int borderStyle,
        double outline,
        double shadow,
        int marginV,
        int marginH,
        boolean bold,
        boolean karaoke,
        int maxWordsPerLine,
        double spacing,
        boolean uppercase,
        List<String> wordColorCycle,
        List<String> wordTags,
        List<String> lineTags) {

    public static final int BOTTOM_CENTER_ALIGNMENT = 2;

    public CaptionStyle {
        maxWordsPerLine = Math.max(1, maxWordsPerLine);
        wordColorCycle = wordColorCycle == null ? List.of() : List.copyOf(wordColorCycle);
        wordTags = wordTags == null ? List.of() : List.copyOf(wordTags);
        lineTags = lineTags == null ? List.of() : List.copyOf(lineTags);
    }
}
