package github.sarthakdev143.segment_forge.dto;

import github.sarthakdev143.segment_forge.model.JobStatus;

public record ResumeResponse(
        String jobId,
        JobStatus status,
        int fromSegmentIndex) {
}
