package github.sarthakdev143.segment_forge.model;

import java.time.Instant;

public record SegmentLogEntry(Instant timestamp, String message) {

    @Override
    public String toString() {
        return "[" + timestamp + "] " + message;
    }
}
