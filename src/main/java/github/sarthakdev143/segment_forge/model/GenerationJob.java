package github.sarthakdev143.segment_forge.model;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * A video assembly job and the segments it owns.
 * <p>
 * The main segment loop and out-of-band retries touch the same job from different threads, so
 * every read and write of the job or one of its segments goes through {@link #locked}. External
 * calls (speech, rendering, ffmpeg) must never run while the lock is held.
 */
public class GenerationJob {

    private final String id;
    private final List<Segment> segments = new ArrayList<>();
    private final Instant createdAt;
    private final ReentrantLock lock = new ReentrantLock();
    private String context;
    private JobStatus status = JobStatus.IDLE;
    private int currentSegmentIndex;
    private Path finalVideoPath;
    private boolean loopActive;
    private Instant updatedAt;

    public GenerationJob(List<Segment> initialSegments, String context) {
        this.id = UUID.randomUUID().toString();
        this.context = context;
        this.createdAt = Instant.now();
        this.updatedAt = createdAt;
        if (initialSegments != null) {
            segments.addAll(initialSegments);
        }
        renumber();
    }

    public <T> T locked(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public void locked(Runnable action) {
        lock.lock();
        try {
            action.run();
        } finally {
            lock.unlock();
        }
    }

    public JobSnapshot snapshot() {
        return locked(() -> new JobSnapshot(
                id,
                status,
                currentSegmentIndex,
                finalVideoPath == null ? null : finalVideoPath.toString(),
                context,
                segments.stream().map(Segment::snapshot).toList(),
                createdAt,
                updatedAt));
    }

    public Optional<Segment> findSegment(String segmentId) {
        return locked(() -> segments.stream()
                .filter(segment -> segment.getId().equals(segmentId))
                .findFirst());
    }

    public int indexOf(String segmentId) {
        return locked(() -> {
            for (int index = 0; index < segments.size(); index++) {
                if (segments.get(index).getId().equals(segmentId)) {
                    return index;
                }
            }
            return -1;
        });
    }

    public int segmentCount() {
        return locked(segments::size);
    }

    public Segment segmentAt(int index) {
        return locked(() -> segments.get(index));
    }

    /** Nearest segment before {@code index} that finished successfully, if any. */
    public Optional<Segment> previousCompleted(int index) {
        return locked(() -> {
            for (int candidate = Math.min(index, segments.size()) - 1; candidate >= 0; candidate--) {
                Segment segment = segments.get(candidate);
                if (segment.getStatus() == SegmentStatus.COMPLETED) {
                    return Optional.of(segment);
                }
            }
            return Optional.<Segment>empty();
        });
    }

    /** Index of the first segment that is not completed, or the segment count when all are. */
    public int firstIncompleteIndex() {
        return locked(() -> {
            for (int index = 0; index < segments.size(); index++) {
                if (segments.get(index).getStatus() != SegmentStatus.COMPLETED) {
                    return index;
                }
            }
            return segments.size();
        });
    }

    public boolean allSegmentsCompleted() {
        return locked(() -> !segments.isEmpty()
                && segments.stream().allMatch(segment -> segment.getStatus() == SegmentStatus.COMPLETED));
    }

    /** Playable outputs of all segments in ascending order. */
    public List<Path> orderedOutputs() {
        return locked(() -> segments.stream()
                .sorted(Comparator.comparingInt(Segment::getOrder))
                .map(Segment::outputPath)
                .filter(path -> path != null)
                .toList());
    }

    public void removeSegment(String segmentId) {
        locked(() -> {
            segments.removeIf(segment -> segment.getId().equals(segmentId));
            renumber();
            currentSegmentIndex = Math.min(currentSegmentIndex, Math.max(segments.size() - 1, 0));
            touch();
        });
    }

    public void moveSegment(String segmentId, int targetOrder) {
        locked(() -> {
            int from = indexOf(segmentId);
            if (from < 0) {
                return;
            }
            int to = Math.max(0, Math.min(targetOrder, segments.size() - 1));
            Segment moved = segments.remove(from);
            segments.add(to, moved);
            renumber();
            touch();
        });
    }

    public void replaceSegments(List<Segment> replacement, String newContext) {
        locked(() -> {
            segments.clear();
            segments.addAll(replacement);
            renumber();
            currentSegmentIndex = 0;
            finalVideoPath = null;
            if (newContext != null) {
                context = newContext;
            }
            touch();
        });
    }

    private void renumber() {
        for (int index = 0; index < segments.size(); index++) {
            segments.get(index).setOrder(index);
        }
    }

    public void touch() {
        updatedAt = Instant.now();
    }

    public String getId() {
        return id;
    }

    public String getContext() {
        return locked(() -> context);
    }

    public JobStatus getStatus() {
        return locked(() -> status);
    }

    public void setStatus(JobStatus status) {
        locked(() -> {
            this.status = status;
            touch();
        });
    }

    public int getCurrentSegmentIndex() {
        return locked(() -> currentSegmentIndex);
    }

    public void setCurrentSegmentIndex(int currentSegmentIndex) {
        locked(() -> {
            this.currentSegmentIndex = currentSegmentIndex;
            touch();
        });
    }

    public Path getFinalVideoPath() {
        return locked(() -> finalVideoPath);
    }

    public void setFinalVideoPath(Path finalVideoPath) {
        locked(() -> {
            this.finalVideoPath = finalVideoPath;
            touch();
        });
    }

    public boolean isLoopActive() {
        return locked(() -> loopActive);
    }

    public void setLoopActive(boolean loopActive) {
        locked(() -> {
            this.loopActive = loopActive;
        });
    }

    public Instant getCreatedAt() {
        return createdAt;
    }
}
