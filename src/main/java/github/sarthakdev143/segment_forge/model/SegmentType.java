package github.sarthakdev143.segment_forge.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum SegmentType {
    ANIMATION,
    MANIM,
    PYSIM,
    TRANSITION;

    public static SegmentType fromInput(String input) {
        if (input == null || input.isBlank()) {
            throw new IllegalArgumentException("type is required.");
        }

        try {
            return SegmentType.valueOf(input.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("type must be one of animation, manim, pysim, transition.");
        }
    }

    /**
     * Categories whose backend only emits short fixed-length clips, so longer narration
     * has to be covered by several clips merged together.
     */
    public boolean requiresChunking() {
        return this == ANIMATION;
    }

    /**
     * Categories whose backend authors a script that can be previewed before it is executed.
     */
    public boolean supportsScriptPreview() {
        return this == MANIM || this == PYSIM;
    }

    @JsonValue
    public String toApiValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
