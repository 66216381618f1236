package github.sarthakdev143.segment_forge.exception;

/**
 * Any failure that ends a segment attempt. The message is what gets recorded on the segment.
 */
public class SegmentFailureException extends Exception {

    public SegmentFailureException(String message) {
        super(message);
    }

    public SegmentFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
