package github.sarthakdev143.story_renderer.model;

import java.util.Locale;

public enum Orientation {
    LANDSCAPE(1920, 1080),
    PORTRAIT(1080, 1920),
    SQUARE(1080, 1080);

    private final int width;
    private final int height;

    Orientation(int width, int height) {
        this.width = width;
        this.height = height;
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    /**
     * Unknown or missing orientation tags fall back to landscape rather than rejecting the project.
     */
    public static Orientation fromInput(String input) {
        if (input == null || input.isBlank()) {
            return LANDSCAPE;
        }

        try {
            return Orientation.valueOf(input.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            return LANDSCAPE;
        }
    }

    public String toApiValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
