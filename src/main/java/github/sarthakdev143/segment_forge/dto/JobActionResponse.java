package github.sarthakdev143.segment_forge.dto;

import github.sarthakdev143.segment_forge.model.JobStatus;

public record JobActionResponse(
        String jobId,
        JobStatus status,
        int currentSegmentIndex,
        String message) {
}
