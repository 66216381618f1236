package github.sarthakdev143.segment_forge.dto;

import github.sarthakdev143.segment_forge.model.SegmentStatus;

public record RetryResponse(
        String jobId,
        String segmentId,
        SegmentStatus status,
        String message) {
}
