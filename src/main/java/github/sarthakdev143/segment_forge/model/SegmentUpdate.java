package github.sarthakdev143.segment_forge.model;

import github.sarthakdev143.segment_forge.model.visual.VisualSpec;

/**
 * Partial edit of a segment. {@code null} fields are left unchanged.
 */
public record SegmentUpdate(
        String title,
        String description,
        VisualSpec visualSpec,
        VoiceoverConfig voiceover,
        Integer order) {

    public boolean isEmpty() {
        return title == null && description == null && visualSpec == null && voiceover == null && order == null;
    }
}
