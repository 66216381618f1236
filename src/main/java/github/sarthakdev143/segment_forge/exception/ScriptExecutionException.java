package github.sarthakdev143.segment_forge.exception;

/**
 * A script was produced but failed to run. The script is kept for inspection and retries.
 */
public class ScriptExecutionException extends SegmentFailureException {

    private final String script;

    public ScriptExecutionException(String message, String script) {
        super(message);
        this.script = script;
    }

    public String getScript() {
        return script;
    }
}
