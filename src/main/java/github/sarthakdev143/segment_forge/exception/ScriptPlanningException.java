package github.sarthakdev143.segment_forge.exception;

/**
 * The renderer could not produce a script at all.
 */
public class ScriptPlanningException extends SegmentFailureException {

    public ScriptPlanningException(String message) {
        super(message);
    }

    public ScriptPlanningException(String message, Throwable cause) {
        super(message, cause);
    }
}
