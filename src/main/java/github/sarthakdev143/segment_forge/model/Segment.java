package github.sarthakdev143.segment_forge.model;

import github.sarthakdev143.segment_forge.model.visual.VisualSpec;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * One narrated visual beat of a job. Instances are owned by exactly one {@link GenerationJob} and
 * must only be mutated while holding that job's lock.
 */
public class Segment {

    private final String id;
    private final Instant createdAt;
    private int order;
    private String title;
    private String description;
    private VoiceoverConfig voiceover;
    private VisualSpec visualSpec;
    private SegmentStatus status = SegmentStatus.PENDING;
    private Path videoPath;
    private Path audioPath;
    private Path combinedPath;
    private Double durationSeconds;
    private String generatedScript;
    private String error;
    private String previousError;
    private final List<SegmentLogEntry> logs = new ArrayList<>();
    private Instant updatedAt;

    public Segment(String title, String description, VoiceoverConfig voiceover, VisualSpec visualSpec) {
        this(UUID.randomUUID().toString(), title, description, voiceover, visualSpec);
    }

    public Segment(String id, String title, String description, VoiceoverConfig voiceover, VisualSpec visualSpec) {
        this.id = Objects.requireNonNull(id, "id");
        this.title = title;
        this.description = description;
        this.voiceover = voiceover;
        this.visualSpec = Objects.requireNonNull(visualSpec, "visualSpec");
        this.createdAt = Instant.now();
        this.updatedAt = createdAt;
    }

    public void addLog(String message) {
        Instant now = Instant.now();
        logs.add(new SegmentLogEntry(now, message));
        updatedAt = now;
    }

    /**
     * Clears outputs and the log for another attempt. The failed attempt's error is kept as
     * retry context until the segment next completes.
     */
    public void resetForRetry() {
        if (error != null) {
            previousError = error;
        }
        status = SegmentStatus.PROCESSING;
        error = null;
        videoPath = null;
        audioPath = null;
        combinedPath = null;
        logs.clear();
        touch();
    }

    /** Back to pending after an edit; prior outputs no longer match the content. */
    public void resetToPending() {
        status = SegmentStatus.PENDING;
        error = null;
        previousError = null;
        videoPath = null;
        audioPath = null;
        combinedPath = null;
        durationSeconds = null;
        generatedScript = null;
        touch();
    }

    public void markProcessing() {
        status = SegmentStatus.PROCESSING;
        error = null;
        touch();
    }

    public void markCompleted() {
        status = SegmentStatus.COMPLETED;
        error = null;
        previousError = null;
        touch();
    }

    public void markFailed(String errorMessage) {
        status = SegmentStatus.FAILED;
        error = errorMessage;
        touch();
    }

    /** Playable output: the muxed clip when there is one, the raw visual otherwise. */
    public Path outputPath() {
        return combinedPath != null ? combinedPath : videoPath;
    }

    public SegmentSnapshot snapshot() {
        return new SegmentSnapshot(
                id,
                order,
                type(),
                title,
                description,
                voiceover,
                visualSpec,
                status,
                pathString(videoPath),
                pathString(audioPath),
                pathString(combinedPath),
                durationSeconds,
                generatedScript,
                error,
                logs.stream().map(SegmentLogEntry::toString).toList(),
                createdAt,
                updatedAt);
    }

    private static String pathString(Path path) {
        return path == null ? null : path.toString();
    }

    private void touch() {
        updatedAt = Instant.now();
    }

    public String getId() {
        return id;
    }

    public SegmentType type() {
        return visualSpec.type();
    }

    public int getOrder() {
        return order;
    }

    public void setOrder(int order) {
        this.order = order;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
        touch();
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
        touch();
    }

    public VoiceoverConfig getVoiceover() {
        return voiceover;
    }

    public void setVoiceover(VoiceoverConfig voiceover) {
        this.voiceover = voiceover;
        touch();
    }

    public VisualSpec getVisualSpec() {
        return visualSpec;
    }

    public void setVisualSpec(VisualSpec visualSpec) {
        this.visualSpec = Objects.requireNonNull(visualSpec, "visualSpec");
        touch();
    }

    public SegmentStatus getStatus() {
        return status;
    }

    public Path getVideoPath() {
        return videoPath;
    }

    public void setVideoPath(Path videoPath) {
        this.videoPath = videoPath;
        touch();
    }

    public Path getAudioPath() {
        return audioPath;
    }

    public void setAudioPath(Path audioPath) {
        this.audioPath = audioPath;
        touch();
    }

    public Path getCombinedPath() {
        return combinedPath;
    }

    public void setCombinedPath(Path combinedPath) {
        this.combinedPath = combinedPath;
        touch();
    }

    public Double getDurationSeconds() {
        return durationSeconds;
    }

    public void setDurationSeconds(Double durationSeconds) {
        this.durationSeconds = durationSeconds;
        touch();
    }

    public String getGeneratedScript() {
        return generatedScript;
    }

    public void setGeneratedScript(String generatedScript) {
        this.generatedScript = generatedScript;
        touch();
    }

    public String getError() {
        return error;
    }

    public String getPreviousError() {
        return previousError;
    }

    public List<SegmentLogEntry> getLogs() {
        return List.copyOf(logs);
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }
}
