package github.sarthakdev143.segment_forge.service;

import github.sarthakdev143.segment_forge.model.JobSnapshot;
import github.sarthakdev143.segment_forge.model.Segment;
import github.sarthakdev143.segment_forge.model.SegmentSnapshot;
import github.sarthakdev143.segment_forge.model.SegmentUpdate;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Owns the job lifecycle: idle, running, paused, completed (or failed on an unexpected crash).
 * Unknown ids raise {@code JobNotFoundException} / {@code SegmentNotFoundException}; operations
 * that conflict with the current state raise {@link IllegalStateException}.
 */
public interface JobStateMachine {

    JobSnapshot create(List<Segment> segments, String context);

    JobSnapshot get(String jobId);

    /**
     * Moves an idle job to running and starts the segment loop in the background.
     */
    JobSnapshot start(String jobId);

    /**
     * Requests a pause. The loop observes it before the next segment; the current one finishes.
     */
    JobSnapshot pause(String jobId);

    /**
     * Restarts the loop at {@code index}; completed segments from there on are skipped.
     */
    JobSnapshot resumeFrom(String jobId, int index);

    /**
     * Restarts the loop at the first segment that is not completed and returns that index.
     */
    int resume(String jobId);

    /**
     * Reprocesses one segment in the background, independently of the segment loop.
     *
     * @return the segment as it is right after the reset, in processing state
     */
    SegmentSnapshot retrySegment(String jobId, String segmentId);

    SegmentSnapshot updateSegment(String jobId, String segmentId, SegmentUpdate update);

    JobSnapshot deleteSegment(String jobId, String segmentId);

    JobSnapshot replaceSegments(String jobId, List<Segment> segments, String context);

    SegmentSnapshot getSegment(String jobId, String segmentId);

    Optional<Path> segmentVideo(String jobId, String segmentId);

    /**
     * The assembled video of a completed job, if assembly succeeded and the file still exists.
     *
     * @throws IllegalStateException when the job is not completed
     */
    Optional<Path> finalVideo(String jobId);
}
