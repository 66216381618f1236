package github.sarthakdev143.segment_forge.model;

import github.sarthakdev143.segment_forge.model.visual.VisualSpec;

import java.time.Instant;
import java.util.List;

public record SegmentSnapshot(
        String id,
        int order,
        SegmentType type,
        String title,
        String description,
        VoiceoverConfig voiceover,
        VisualSpec visualSpec,
        SegmentStatus status,
        String videoPath,
        String audioPath,
        String combinedPath,
        Double durationSeconds,
        String generatedScript,
        String error,
        List<String> logs,
        Instant createdAt,
        Instant updatedAt) {

    public SegmentSnapshot {
        logs = logs == null ? List.of() : List.copyOf(logs);
    }
}
