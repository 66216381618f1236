package github.sarthakdev143.segment_forge.service;

import github.sarthakdev143.segment_forge.exception.SegmentFailureException;

import java.nio.file.Path;
import java.util.List;

public interface FinalAssembler {

    /**
     * Concatenates segment outputs, already sorted by segment order, into one video.
     */
    Path assemble(String jobId, List<Path> clips) throws SegmentFailureException, InterruptedException;
}
