package github.sarthakdev143.segment_forge.integration.media;

import github.sarthakdev143.segment_forge.exception.SegmentFailureException;

import java.nio.file.Path;

public interface MediaProbe {

    double durationSeconds(Path media) throws SegmentFailureException, InterruptedException;

    boolean hasAudioStream(Path media) throws SegmentFailureException, InterruptedException;
}
