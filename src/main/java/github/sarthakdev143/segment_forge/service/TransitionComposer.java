package github.sarthakdev143.segment_forge.service;

import github.sarthakdev143.segment_forge.exception.SegmentFailureException;

import java.nio.file.Path;

public interface TransitionComposer {

    /**
     * Builds a bridge clip carrying {@code narration}. The still background is taken from the end
     * of {@code previousOutput}, or is black when there is none.
     *
     * @param previousOutput playable output of the previous completed segment, may be {@code null}
     */
    Path compose(String title, String description, Path narration, double durationSeconds, Path previousOutput)
            throws SegmentFailureException, InterruptedException;
}
