package github.sarthakdev143.segment_forge.model.visual;

import github.sarthakdev143.segment_forge.model.SegmentType;

import java.util.Map;

public record AnimationSpec(String style) implements VisualSpec {

    @Override
    public SegmentType type() {
        return SegmentType.ANIMATION;
    }

    @Override
    public Map<String, Object> metadata() {
        return style == null || style.isBlank() ? Map.of() : Map.of("style", style);
    }
}
