package github.sarthakdev143.segment_forge.dto;

public record VoiceoverRequest(
        String text,
        String voice,
        Double speed) {
}
