package github.sarthakdev143.segment_forge.service;

import github.sarthakdev143.segment_forge.exception.SegmentFailureException;
import github.sarthakdev143.segment_forge.model.GenerationJob;
import github.sarthakdev143.segment_forge.model.Segment;

public interface SegmentProcessor {

    /**
     * Runs the narration, visual, reconcile and combine steps for one segment. The segment ends
     * completed on return, or failed with its error recorded when this throws.
     *
     * @param previousCompleted nearest earlier completed segment, used as transition background
     */
    void process(GenerationJob job, Segment segment, Segment previousCompleted)
            throws SegmentFailureException, InterruptedException;
}
