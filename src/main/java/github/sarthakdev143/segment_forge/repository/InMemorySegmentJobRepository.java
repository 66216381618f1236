package github.sarthakdev143.segment_forge.repository;

import github.sarthakdev143.segment_forge.model.GenerationJob;
import org.springframework.stereotype.Repository;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Repository
public class InMemorySegmentJobRepository implements SegmentJobRepository {

    private final Map<String, GenerationJob> jobs = new ConcurrentHashMap<>();

    @Override
    public GenerationJob save(GenerationJob job) {
        jobs.put(job.getId(), job);
        return job;
    }

    @Override
    public Optional<GenerationJob> findById(String jobId) {
        return Optional.ofNullable(jobs.get(jobId));
    }
}
