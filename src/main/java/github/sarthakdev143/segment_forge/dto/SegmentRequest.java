package github.sarthakdev143.segment_forge.dto;

/**
 * One segment of a job plan. {@code style}, {@code simulationType} and {@code conclusion} are
 * read according to {@code type}; fields a category does not use are ignored.
 */
public record SegmentRequest(
        String type,
        String title,
        String description,
        VoiceoverRequest voiceover,
        String style,
        String simulationType,
        Boolean conclusion) {
}
