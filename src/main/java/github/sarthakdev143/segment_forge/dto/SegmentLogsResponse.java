package github.sarthakdev143.segment_forge.dto;

import github.sarthakdev143.segment_forge.model.SegmentStatus;

import java.util.List;

public record SegmentLogsResponse(
        String segmentId,
        SegmentStatus status,
        String error,
        String generatedScript,
        List<String> logs) {
}
