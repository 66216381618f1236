package github.sarthakdev143.segment_forge.dto;

import java.util.List;

public record CreateJobRequest(
        List<SegmentRequest> segments,
        String context) {
}
