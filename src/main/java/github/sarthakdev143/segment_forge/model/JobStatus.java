package github.sarthakdev143.segment_forge.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum JobStatus {
    IDLE,
    RUNNING,
    PAUSED,
    COMPLETED,
    FAILED;

    @JsonValue
    public String toApiValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
