package github.sarthakdev143.segment_forge.model.visual;

import github.sarthakdev143.segment_forge.model.SegmentType;

import java.util.LinkedHashMap;
import java.util.Map;

public record ManimSpec(String style, boolean conclusion) implements VisualSpec {

    @Override
    public SegmentType type() {
        return SegmentType.MANIM;
    }

    @Override
    public Map<String, Object> metadata() {
        Map<String, Object> metadata = new LinkedHashMap<>();
        if (style != null && !style.isBlank()) {
            metadata.put("style", style);
        }
        if (conclusion) {
            metadata.put("is_conclusion", true);
        }
        return metadata;
    }
}
