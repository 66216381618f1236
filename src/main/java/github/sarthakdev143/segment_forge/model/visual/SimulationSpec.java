package github.sarthakdev143.segment_forge.model.visual;

import github.sarthakdev143.segment_forge.model.SegmentType;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * @param simulationType optional hint such as {@code physics} or {@code fractal}; the simulation
 *                       backend also reads it as a top-level request field
 */
public record SimulationSpec(String simulationType, boolean conclusion) implements VisualSpec {

    @Override
    public SegmentType type() {
        return SegmentType.PYSIM;
    }

    @Override
    public Map<String, Object> metadata() {
        Map<String, Object> metadata = new LinkedHashMap<>();
        if (simulationType != null && !simulationType.isBlank()) {
            metadata.put("simulation_type", simulationType);
        }
        if (conclusion) {
            metadata.put("is_conclusion", true);
        }
        return metadata;
    }
}
