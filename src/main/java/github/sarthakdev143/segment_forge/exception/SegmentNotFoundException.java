package github.sarthakdev143.segment_forge.exception;

public class SegmentNotFoundException extends RuntimeException {

    public SegmentNotFoundException(String jobId, String segmentId) {
        super("Segment " + segmentId + " not found in job " + jobId);
    }
}
