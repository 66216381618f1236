package github.sarthakdev143.segment_forge.exception;

public class MediaToolException extends SegmentFailureException {

    private final String stage;
    private final int exitCode;
    private final String output;

    public MediaToolException(String stage, int exitCode, String output) {
        super("Media command failed for stage " + stage + " with exit code " + exitCode + ". Output:\n" + output);
        this.stage = stage;
        this.exitCode = exitCode;
        this.output = output;
    }

    public MediaToolException(String stage, String message, Throwable cause) {
        super("Media command failed for stage " + stage + ": " + message, cause);
        this.stage = stage;
        this.exitCode = -1;
        this.output = "";
    }

    public String getStage() {
        return stage;
    }

    public int getExitCode() {
        return exitCode;
    }

    public String getOutput() {
        return output;
    }
}
