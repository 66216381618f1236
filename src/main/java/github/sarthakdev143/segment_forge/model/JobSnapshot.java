package github.sarthakdev143.segment_forge.model;

import java.time.Instant;
import java.util.List;

public record JobSnapshot(
        String id,
        JobStatus status,
        int currentSegmentIndex,
        String finalVideoPath,
        String context,
        List<SegmentSnapshot> segments,
        Instant createdAt,
        Instant updatedAt) {

    public JobSnapshot {
        segments = segments == null ? List.of() : List.copyOf(segments);
    }
}
