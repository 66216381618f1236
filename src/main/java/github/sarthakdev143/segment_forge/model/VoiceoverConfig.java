package github.sarthakdev143.segment_forge.model;

public record VoiceoverConfig(
        String text,
        String voice,
        double speed) {

    public static final String DEFAULT_VOICE = "Schedar";
    public static final double DEFAULT_SPEED = 1.35;

    public VoiceoverConfig {
        voice = voice == null || voice.isBlank() ? DEFAULT_VOICE : voice.trim();
        speed = speed <= 0.0 ? DEFAULT_SPEED : speed;
    }
}
