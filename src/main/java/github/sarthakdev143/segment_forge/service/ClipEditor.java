package github.sarthakdev143.segment_forge.service;

import github.sarthakdev143.segment_forge.exception.SegmentFailureException;

import java.nio.file.Path;
import java.util.List;

/**
 * Clip-level media edits used while building a segment.
 */
public interface ClipEditor {

    /**
     * Merges clips left to right, crossfading each new clip into the running result.
     */
    Path mergeWithCrossfade(List<Path> clips) throws SegmentFailureException, InterruptedException;

    /**
     * Muxes narration onto a visual. When the narration runs longer the last frame is frozen to
     * cover the gap; otherwise the shorter stream ends the output.
     */
    Path combine(Path video, Path audio) throws SegmentFailureException, InterruptedException;

    Path extractLastFrame(Path video) throws SegmentFailureException, InterruptedException;

    Path blackFrame() throws SegmentFailureException, InterruptedException;
}
