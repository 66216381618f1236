package github.sarthakdev143.segment_forge.service;

import github.sarthakdev143.segment_forge.exception.SegmentFailureException;

import java.nio.file.Path;

public interface DurationMatcher {

    /**
     * Writes a copy of {@code source} retimed to {@code targetSeconds} and returns its path.
     */
    Path match(Path source, double targetSeconds) throws SegmentFailureException, InterruptedException;
}
