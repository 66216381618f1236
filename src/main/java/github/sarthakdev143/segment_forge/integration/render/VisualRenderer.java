package github.sarthakdev143.segment_forge.integration.render;

import github.sarthakdev143.segment_forge.exception.SegmentFailureException;
import github.sarthakdev143.segment_forge.model.render.RenderOutcome;
import github.sarthakdev143.segment_forge.model.render.RenderRequest;

/**
 * Client for the visual renderer backends.
 */
public interface VisualRenderer {

    /**
     * Asks the backend to author a script without executing it.
     */
    String generateScript(RenderRequest request) throws SegmentFailureException;

    /**
     * Renders a clip, executing {@code request.script()} verbatim when one is given.
     * A backend that authored or received a script but failed to run it yields
     * {@link RenderOutcome.ScriptOnly}; every other failure is thrown.
     */
    RenderOutcome render(RenderRequest request) throws SegmentFailureException;
}
