package github.sarthakdev143.segment_forge.model.visual;

import github.sarthakdev143.segment_forge.model.SegmentType;

import java.util.Map;

public record TransitionSpec(boolean conclusion) implements VisualSpec {

    @Override
    public SegmentType type() {
        return SegmentType.TRANSITION;
    }

    @Override
    public Map<String, Object> metadata() {
        return conclusion ? Map.of("is_conclusion", true) : Map.of();
    }
}
