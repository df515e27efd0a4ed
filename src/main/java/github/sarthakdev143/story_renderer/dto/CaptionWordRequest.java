package github.sarthakdev143.story_renderer.dto;

import com.fasterxml.jackson.annotation.JsonAlias;

public record CaptionWordRequest(
        @JsonAlias({"word", "token"}) String text,
        Double start,
        Double end) {
}
