package github.sarthakdev143.story_renderer.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum RenderJobStatus {
    QUEUED,
    RENDERING,
    CANCELLING,
    PAUSING,
    COMPLETED,
    FAILED,
    CANCELLED,
    PAUSED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED || this == PAUSED;
    }

    public boolean isStopping() {
        return this == CANCELLING || this == PAUSING;
    }

    public boolean isStopTarget() {
        return this == CANCELLED || this == PAUSED;
    }

    /**
     * Interim marker shown while an in-flight job winds down toward {@code target}.
     */
    public static RenderJobStatus interimFor(RenderJobStatus target) {
        return switch (target) {
            case CANCELLED -> CANCELLING;
            case PAUSED -> PAUSING;
            default -> throw new IllegalArgumentException("Stop target must be cancelled or paused, got " + target);
        };
    }

    /**
     * Terminal status an interim marker resolves to.
     */
    public RenderJobStatus stopTarget() {
        return switch (this) {
            case CANCELLING -> CANCELLED;
            case PAUSING -> PAUSED;
            default -> throw new IllegalStateException(this + " is not a stopping status");
        };
    }

    @JsonCreator
    public static RenderJobStatus fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("status is required.");
        }
        return RenderJobStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    @JsonValue
    public String toApiValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
