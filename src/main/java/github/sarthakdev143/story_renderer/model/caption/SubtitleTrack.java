package github.sarthakdev143.story_renderer.model.caption;

import java.util.List;

public record SubtitleTrack(
        CaptionStyle style,
        int playResX,
        int playResY,
        List<SubtitleEvent> events) {

    public SubtitleTrack {
        events = events == null ? List.of() : List.copyOf(events);
    }

    public boolean isEmpty() {
        return events.isEmpty();
    }
}
