package github.sarthakdev143.segment_forge.repository;

import github.sarthakdev143.segment_forge.model.GenerationJob;

import java.util.Optional;

/**
 * Key-value store of live jobs, keyed by job id.
 */
public interface SegmentJobRepository {

    GenerationJob save(GenerationJob job);

    Optional<GenerationJob> findById(String jobId);
}
