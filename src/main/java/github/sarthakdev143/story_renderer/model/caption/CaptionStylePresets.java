package github.sarthakdev143.story_renderer.model.caption;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Fixed registry of caption presets. Lookups accept the display name, the ASS style name, or a
 * punctuation-free slug of either; anything else resolves to {@link #DEFAULT_STYLE}.
 */
public final class CaptionStylePresets {

    public static final String DEFAULT_STYLE = "Classic Clean";

    private static final Map<String, CaptionStyle> PRESETS;
    private static final Map<String, String> NAME_LOOKUP = new HashMap<>();
    private static final Map<String, String> SLUG_LOOKUP = new HashMap<>();

    static {
        Map<String, CaptionStyle> presets = new LinkedHashMap<>();
        register(presets, new CaptionStyle(
                "Classic Clean", "ClassicClean", CaptionStyleMode.LINE,
                "Arial", 40, "&H00FFFFFF", "&H00FFFFFF", "&H00000000", null,
                1, 2.0, 1.0, 60, 80,
                false, false, 10, 0.0, false,
                List.of(), List.of(), List.of()));
        register(presets, new CaptionStyle(
                "Kinetic Pop", "KineticPop", CaptionStyleMode.WORD,
                "Impact", 52, "&H0000DDFF", "&H0000DDFF", "&H00000000", null,
                1, 4.0, 0.0, 84, 90,
                true, false, 1, 1.8, true,
                List.of("&H0000DDFF", "&H00FFC600", "&H009D55FF"),
                List.of("\\bord7", "\\shad0", "\\fscx112", "\\fscy110"),
                List.of()));
        register(presets, new CaptionStyle(
                "Highlight Bar", "HighlightBar", CaptionStyleMode.LINE,
                "Helvetica Neue Bold", 42, "&H0060FFE8", "&H0000D5FF", "&H00000000", "&H99000000",
                3, 1.0, 0.0, 70, 90,
                false, true, 9, 0.0, true,
                List.of(), List.of(), List.of("\\bord0", "\\shad0")));
        register(presets, new CaptionStyle(
                "Outline Glow", "OutlineGlow", CaptionStyleMode.WORD,
                "Arial Black", 48, "&H00E4FDFF", "&H00E4FDFF", "&H007D3DFF", null,
                1, 5.0, 0.0, 80, 100,
                true, false, 1, 0.6, true,
                List.of("&H008040FF", "&H00FFFFFF"),
                List.of("\\bord6", "\\blur4"),
                List.of()));
        register(presets, new CaptionStyle(
                "Subtitle Boxed", "SubtitleBoxed", CaptionStyleMode.LINE,
                "Gill Sans Bold", 44, "&H00F5F5F5", "&H003CFFE0", "&H00000000", "&HB0000000",
                3, 0.0, 0.0, 64, 85,
                true, true, 9, 0.0, true,
                List.of(), List.of(), List.of("\\bord0", "\\shad0")));
        register(presets, new CaptionStyle(
                "Simple Minimal", "SimpleMinimal", CaptionStyleMode.LINE,
                "Helvetica Neue", 36, "&H00F5F5F5", "&H00F5F5F5", "&H00202020", null,
                1, 1.0, 0.4, 70, 90,
                false, false, 10, 0.4, false,
                List.of(), List.of(), List.of("\\bord1", "\\shad0")));
        PRESETS = Collections.unmodifiableMap(presets);
    }

    private CaptionStylePresets() {
    }

    public static CaptionStyle resolve(String styleName) {
        return PRESETS.get(resolveDisplayName(styleName));
    }

    public static String resolveDisplayName(String styleName) {
        if (styleName == null || styleName.isBlank()) {
            return DEFAULT_STYLE;
        }

        String token = styleName.trim();
        if (PRESETS.containsKey(token)) {
            return token;
        }

        String lowered = token.toLowerCase(Locale.ROOT);
        String byName = NAME_LOOKUP.get(lowered);
        if (byName != null) {
            return byName;
        }

        String bySlug = SLUG_LOOKUP.get(slug(lowered));
        return bySlug != null ? bySlug : DEFAULT_STYLE;
    }

    public static Map<String, CaptionStyle> all() {
        return PRESETS;
    }

    private static void register(Map<String, CaptionStyle> presets, CaptionStyle style) {
        presets.put(style.displayName(), style);
        String displayLower = style.displayName().toLowerCase(Locale.ROOT);
        String styleLower = style.styleName().toLowerCase(Locale.ROOT);
        NAME_LOOKUP.put(displayLower, style.displayName());
        NAME_LOOKUP.put(styleLower, style.displayName());
        SLUG_LOOKUP.putIfAbsent(slug(displayLower), style.displayName());
        SLUG_LOOKUP.putIfAbsent(slug(styleLower), style.displayName());
    }

    private static String slug(String value) {
        return value.replaceAll("[^a-z0-9]+", "");
    }
}
