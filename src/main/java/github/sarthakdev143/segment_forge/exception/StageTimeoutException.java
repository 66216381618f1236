package github.sarthakdev143.segment_forge.exception;

import java.time.Duration;

public class StageTimeoutException extends SegmentFailureException {

    private final String stage;
    private final Duration timeout;

    public StageTimeoutException(String stage, Duration timeout) {
        this(stage, timeout, null);
    }

    public StageTimeoutException(String stage, Duration timeout, Throwable cause) {
        super("Stage " + stage + " timed out after " + timeout.toSeconds() + " seconds.", cause);
        this.stage = stage;
        this.timeout = timeout;
    }

    public String getStage() {
        return stage;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
