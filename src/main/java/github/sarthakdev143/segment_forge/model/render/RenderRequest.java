package github.sarthakdev143.segment_forge.model.render;

import github.sarthakdev143.segment_forge.model.SegmentType;
import github.sarthakdev143.segment_forge.model.visual.VisualSpec;

/**
 * One call to a visual renderer backend.
 *
 * @param category      backend to route the call to; usually {@code spec.type()}, but transition
 *                      overlays are drawn by the manim backend
 * @param script        script to execute verbatim, or {@code null} to let the backend author one
 * @param previousError error of the previous attempt, forwarded so the backend can correct itself
 */
public record RenderRequest(
        SegmentType category,
        String title,
        String description,
        double durationSeconds,
        VisualSpec spec,
        String script,
        String previousError) {

    public RenderRequest withScript(String newScript) {
        return new RenderRequest(category, title, description, durationSeconds, spec, newScript, previousError);
    }
}
