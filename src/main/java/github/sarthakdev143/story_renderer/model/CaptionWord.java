package github.sarthakdev143.story_renderer.model;

public record CaptionWord(
        String text,
        double start,
        double end) {

    public CaptionWord shift(double offsetSeconds) {
        return new CaptionWord(text, round3(start + offsetSeconds), round3(end + offsetSeconds));
    }

    public static double round3(double value) {
        return Math.round(value * 1000.0) / 1000.0;
    }
}
