package github.sarthakdev143.segment_forge.dto;

public record SegmentUpdateRequest(
        String title,
        String description,
        String type,
        String style,
        String simulationType,
        Boolean conclusion,
        VoiceoverRequest voiceover,
        Integer order) {
}
