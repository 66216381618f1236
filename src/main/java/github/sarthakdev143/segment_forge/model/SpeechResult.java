package github.sarthakdev143.segment_forge.model;

import java.nio.file.Path;

public record SpeechResult(Path audioPath, double durationSeconds) {
}
