package github.sarthakdev143.segment_forge.model.visual;

import github.sarthakdev143.segment_forge.model.SegmentType;

import java.util.Map;

/**
 * Category-specific rendering parameters of a segment. Each variant carries only the fields
 * its renderer understands and knows how to express them as renderer metadata.
 */
public sealed interface VisualSpec permits AnimationSpec, ManimSpec, SimulationSpec, TransitionSpec {

    SegmentType type();

    Map<String, Object> metadata();
}
