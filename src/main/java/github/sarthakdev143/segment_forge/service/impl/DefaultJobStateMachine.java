package github.sarthakdev143.segment_forge.service.impl;

import github.sarthakdev143.segment_forge.config.TaskExecutionConfig;
import github.sarthakdev143.segment_forge.exception.JobNotFoundException;
import github.sarthakdev143.segment_forge.exception.SegmentFailureException;
import github.sarthakdev143.segment_forge.exception.SegmentNotFoundException;
import github.sarthakdev143.segment_forge.model.GenerationJob;
import github.sarthakdev143.segment_forge.model.JobSnapshot;
import github.sarthakdev143.segment_forge.model.JobStatus;
import github.sarthakdev143.segment_forge.model.Segment;
import github.sarthakdev143.segment_forge.model.SegmentSnapshot;
import github.sarthakdev143.segment_forge.model.SegmentStatus;
import github.sarthakdev143.segment_forge.model.SegmentType;
import github.sarthakdev143.segment_forge.model.SegmentUpdate;
import github.sarthakdev143.segment_forge.model.VoiceoverConfig;
import github.sarthakdev143.segment_forge.model.visual.VisualSpec;
import github.sarthakdev143.segment_forge.repository.SegmentJobRepository;
import github.sarthakdev143.segment_forge.service.FinalAssembler;
import github.sarthakdev143.segment_forge.service.JobStateMachine;
import github.sarthakdev143.segment_forge.service.SegmentProcessor;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runs one background segment loop per job plus any number of out-of-band segment retries.
 * <p>
 * Each job's lock serializes every state change. At most one loop runs per job: a loop is only
 * launched while {@code loopActive} is false, and only the running loop clears the flag, inside
 * the same locked block that records why it stopped. The loop never processes a segment that has
 * a retry in flight. It parks instead, and the retry's thread picks the loop up at that segment
 * once the retry is done, so no thread ever blocks on another task.
 */
@Service
public class DefaultJobStateMachine implements JobStateMachine {

    private static final Logger logger = LoggerFactory.getLogger(DefaultJobStateMachine.class);

    private final SegmentJobRepository repository;
    private final SegmentProcessor segmentProcessor;
    private final FinalAssembler finalAssembler;
    private final TaskExecutor taskExecutor;
    private final Map<String, CompletableFuture<Void>> retries = new ConcurrentHashMap<>();
    private final Counter segmentsCompletedCounter;
    private final Counter mainLoopFailureCounter;
    private final Counter retryFailureCounter;
    private final Counter pausedOnFailureCounter;
    private final Counter jobsCompletedCounter;
    private final Counter finalAssemblyFailureCounter;

    public DefaultJobStateMachine(
            SegmentJobRepository repository,
            SegmentProcessor segmentProcessor,
            FinalAssembler finalAssembler,
            @Qualifier(TaskExecutionConfig.SEGMENT_TASK_EXECUTOR) TaskExecutor taskExecutor,
            MeterRegistry meterRegistry) {
        this.repository = repository;
        this.segmentProcessor = segmentProcessor;
        this.finalAssembler = finalAssembler;
        this.taskExecutor = taskExecutor;
        this.segmentsCompletedCounter = meterRegistry.counter("segment_forge.segments.completed");
        this.mainLoopFailureCounter = meterRegistry.counter("segment_forge.segments.failed", "phase", "main_loop");
        this.retryFailureCounter = meterRegistry.counter("segment_forge.segments.failed", "phase", "retry");
        this.pausedOnFailureCounter = meterRegistry.counter("segment_forge.jobs.paused_on_failure");
        this.jobsCompletedCounter = meterRegistry.counter("segment_forge.jobs.completed");
        this.finalAssemblyFailureCounter = meterRegistry.counter("segment_forge.final_assembly.failures");
    }

    @Override
    public JobSnapshot create(List<Segment> segments, String context) {
        if (segments == null) {
            throw new IllegalArgumentException("segments are required.");
        }

        GenerationJob job = repository.save(new GenerationJob(segments, context));
        logger.info("Created job {} with {} segments", job.getId(), segments.size());
        return job.snapshot();
    }

    @Override
    public JobSnapshot get(String jobId) {
        return requireJob(jobId).snapshot();
    }

    @Override
    public JobSnapshot start(String jobId) {
        GenerationJob job = requireJob(jobId);
        job.locked(() -> {
            if (job.getStatus() != JobStatus.IDLE) {
                throw new IllegalStateException(
                        "Job " + jobId + " can only be started while idle; it is " + job.getStatus().toApiValue() + ".");
            }
            if (job.segmentCount() == 0) {
                throw new IllegalStateException("Job " + jobId + " has no segments to process.");
            }
            job.setStatus(JobStatus.RUNNING);
            job.setCurrentSegmentIndex(0);
            job.setLoopActive(true);
        });

        logger.info("Starting job {}", jobId);
        launchLoop(job, 0, JobStatus.IDLE);
        return job.snapshot();
    }

    @Override
    public JobSnapshot pause(String jobId) {
        GenerationJob job = requireJob(jobId);
        job.locked(() -> {
            if (job.getStatus() == JobStatus.COMPLETED) {
                throw new IllegalStateException("Job " + jobId + " is already completed.");
            }
            job.setStatus(JobStatus.PAUSED);
        });

        logger.info("Pause requested for job {}", jobId);
        return job.snapshot();
    }

    @Override
    public JobSnapshot resumeFrom(String jobId, int index) {
        GenerationJob job = requireJob(jobId);
        JobStatus previousStatus = job.locked(() -> {
            if (job.getStatus() == JobStatus.COMPLETED) {
                throw new IllegalStateException("Job " + jobId + " is already completed.");
            }
            if (job.isLoopActive()) {
                throw new IllegalStateException(
                        "Job " + jobId + " is still finishing segment " + job.getCurrentSegmentIndex()
                                + "; resume once it has stopped.");
            }
            int segmentCount = job.segmentCount();
            if (segmentCount == 0) {
                throw new IllegalStateException("Job " + jobId + " has no segments to process.");
            }
            if (index < 0 || index >= segmentCount) {
                throw new IllegalArgumentException("index must be between 0 and " + (segmentCount - 1) + ".");
            }
            JobStatus current = job.getStatus();
            job.setStatus(JobStatus.RUNNING);
            job.setCurrentSegmentIndex(index);
            job.setLoopActive(true);
            return current;
        });

        logger.info("Resuming job {} from segment {}", jobId, index);
        launchLoop(job, index, previousStatus);
        return job.snapshot();
    }

    @Override
    public int resume(String jobId) {
        GenerationJob job = requireJob(jobId);
        int index = job.locked(() -> {
            int firstIncomplete = job.firstIncompleteIndex();
            // All segments done (e.g. fixed by retries): rerun the loop so the job completes.
            return firstIncomplete >= job.segmentCount() ? 0 : firstIncomplete;
        });
        resumeFrom(jobId, index);
        return index;
    }

    @Override
    public SegmentSnapshot retrySegment(String jobId, String segmentId) {
        GenerationJob job = requireJob(jobId);
        String key = retryKey(jobId, segmentId);
        CompletableFuture<Void> retry = new CompletableFuture<>();

        SegmentSnapshot snapshot = job.locked(() -> {
            Segment segment = requireSegment(job, segmentId);
            if (retries.containsKey(key) || segment.getStatus() == SegmentStatus.PROCESSING) {
                throw new IllegalStateException("Segment " + segmentId + " is already being processed.");
            }
            segment.resetForRetry();
            segment.addLog("Retry requested.");
            retries.put(key, retry);
            return segment.snapshot();
        });

        Segment segment = requireSegment(job, segmentId);
        logger.info("Retrying segment {} of job {}", segmentId, jobId);
        try {
            taskExecutor.execute(() -> runRetry(job, segment, key, retry));
        } catch (RuntimeException e) {
            job.locked(() -> segment.markFailed("Retry could not be scheduled: " + e.getMessage()));
            retries.remove(key);
            retry.complete(null);
            if (e instanceof TaskRejectedException) {
                throw new IllegalStateException(
                        "Too many jobs and retries are running; retry segment " + segmentId + " later.", e);
            }
            throw e;
        }
        return snapshot;
    }

    @Override
    public SegmentSnapshot updateSegment(String jobId, String segmentId, SegmentUpdate update) {
        if (update == null || update.isEmpty()) {
            throw new IllegalArgumentException("At least one field must be updated.");
        }

        GenerationJob job = requireJob(jobId);
        SegmentSnapshot snapshot = job.locked(() -> {
            Segment segment = requireSegment(job, segmentId);
            if (segment.getStatus() == SegmentStatus.PROCESSING) {
                throw new IllegalStateException(
                        "Segment " + segmentId + " is being processed; edit it once it has finished.");
            }
            if (update.order() != null) {
                if (isBusy(job)) {
                    throw new IllegalStateException("Pause job " + jobId + " before reordering segments.");
                }
                if (update.order() < 0 || update.order() >= job.segmentCount()) {
                    throw new IllegalArgumentException(
                            "order must be between 0 and " + (job.segmentCount() - 1) + ".");
                }
            }

            VisualSpec visualSpec = update.visualSpec() != null ? update.visualSpec() : segment.getVisualSpec();
            VoiceoverConfig voiceover = update.voiceover() != null ? update.voiceover() : segment.getVoiceover();
            if (visualSpec.type() == SegmentType.TRANSITION && voiceover == null) {
                throw new IllegalArgumentException("transition segments require a voiceover.");
            }

            if (update.title() != null) {
                segment.setTitle(update.title());
            }
            if (update.description() != null) {
                segment.setDescription(update.description());
            }
            segment.setVisualSpec(visualSpec);
            segment.setVoiceover(voiceover);
            segment.resetToPending();
            segment.addLog("Segment edited, outputs cleared.");
            if (update.order() != null) {
                job.moveSegment(segmentId, update.order());
            }
            job.touch();
            return segment.snapshot();
        });

        logger.info("Updated segment {} of job {}", segmentId, jobId);
        return snapshot;
    }

    @Override
    public JobSnapshot deleteSegment(String jobId, String segmentId) {
        GenerationJob job = requireJob(jobId);
        job.locked(() -> {
            Segment segment = requireSegment(job, segmentId);
            if (isBusy(job)) {
                throw new IllegalStateException("Pause job " + jobId + " before deleting segments.");
            }
            if (segment.getStatus() == SegmentStatus.PROCESSING) {
                throw new IllegalStateException(
                        "Segment " + segmentId + " is being processed; delete it once it has finished.");
            }
            job.removeSegment(segmentId);
        });

        logger.info("Deleted segment {} from job {}", segmentId, jobId);
        return job.snapshot();
    }

    @Override
    public JobSnapshot replaceSegments(String jobId, List<Segment> segments, String context) {
        if (segments == null) {
            throw new IllegalArgumentException("segments are required.");
        }

        GenerationJob job = requireJob(jobId);
        job.locked(() -> {
            if (isBusy(job)) {
                throw new IllegalStateException("Pause job " + jobId + " before replacing its segments.");
            }
            if (hasPendingRetries(jobId)) {
                throw new IllegalStateException(
                        "Job " + jobId + " has segment retries in flight; replace its segments once they finish.");
            }
            job.replaceSegments(segments, context);
            job.setStatus(JobStatus.IDLE);
        });

        logger.info("Replaced segments of job {} with {} segments", jobId, segments.size());
        return job.snapshot();
    }

    @Override
    public SegmentSnapshot getSegment(String jobId, String segmentId) {
        GenerationJob job = requireJob(jobId);
        return job.locked(() -> requireSegment(job, segmentId).snapshot());
    }

    @Override
    public Optional<Path> segmentVideo(String jobId, String segmentId) {
        GenerationJob job = requireJob(jobId);
        Path output = job.locked(() -> requireSegment(job, segmentId).outputPath());
        return Optional.ofNullable(output).filter(Files::isRegularFile);
    }

    @Override
    public Optional<Path> finalVideo(String jobId) {
        GenerationJob job = requireJob(jobId);
        Path finalVideo = job.locked(() -> {
            if (job.getStatus() != JobStatus.COMPLETED) {
                throw new IllegalStateException(
                        "Job " + jobId + " is not completed; it is " + job.getStatus().toApiValue() + ".");
            }
            return job.getFinalVideoPath();
        });
        return Optional.ofNullable(finalVideo).filter(Files::isRegularFile);
    }

    private void launchLoop(GenerationJob job, int index, JobStatus statusIfRejected) {
        try {
            taskExecutor.execute(() -> runLoop(job, index));
        } catch (RuntimeException e) {
            job.locked(() -> {
                job.setStatus(statusIfRejected);
                job.setLoopActive(false);
            });
            if (e instanceof TaskRejectedException) {
                throw new IllegalStateException(
                        "Too many jobs and retries are running; run job " + job.getId() + " later.", e);
            }
            throw e;
        }
    }

    private void runLoop(GenerationJob job, int startIndex) {
        try {
            int index = startIndex;
            while (true) {
                LoopStep step = nextStep(job, index);
                switch (step.action()) {
                    case STOP:
                        return;
                    case FINISH:
                        jobsCompletedCounter.increment();
                        logger.info("Job {} completed, assembling final video", job.getId());
                        assembleFinalVideo(job);
                        return;
                    case SKIP:
                        index++;
                        break;
                    case AWAIT_RETRY:
                        int resumeIndex = index;
                        logger.info("Job {} waits for a segment retry before segment {}", job.getId(), index);
                        step.retry().whenComplete((ignored, error) -> runLoop(job, resumeIndex));
                        return;
                    case PROCESS:
                        if (!processInLoop(job, step, index)) {
                            return;
                        }
                        index++;
                        break;
                    default:
                        throw new IllegalStateException("Unhandled loop action " + step.action());
                }
            }
        } catch (RuntimeException e) {
            logger.error("Segment loop of job {} crashed", job.getId(), e);
            job.locked(() -> {
                job.setStatus(JobStatus.FAILED);
                job.setLoopActive(false);
            });
        }
    }

    private LoopStep nextStep(GenerationJob job, int index) {
        return job.locked(() -> {
            if (index >= job.segmentCount()) {
                return finishStep(job);
            }
            if (job.getStatus() != JobStatus.RUNNING) {
                job.setCurrentSegmentIndex(index);
                job.setLoopActive(false);
                logger.info("Job {} paused before segment {}", job.getId(), index);
                return LoopStep.of(LoopAction.STOP);
            }

            job.setCurrentSegmentIndex(index);
            Segment segment = job.segmentAt(index);
            CompletableFuture<Void> retry = retries.get(retryKey(job.getId(), segment.getId()));
            if (retry != null) {
                return LoopStep.awaiting(retry);
            }
            if (segment.getStatus() == SegmentStatus.COMPLETED) {
                return LoopStep.of(LoopAction.SKIP);
            }

            segment.markProcessing();
            return new LoopStep(LoopAction.PROCESS, segment, job.previousCompleted(index).orElse(null), null);
        });
    }

    // Caller holds the job lock, so no retry can be registered between the check and the status change.
    private LoopStep finishStep(GenerationJob job) {
        Optional<CompletableFuture<Void>> pendingRetry = pendingRetry(job.getId());
        if (pendingRetry.isPresent()) {
            return LoopStep.awaiting(pendingRetry.get());
        }
        if (!job.allSegmentsCompleted()) {
            job.setStatus(JobStatus.PAUSED);
            job.setCurrentSegmentIndex(job.firstIncompleteIndex());
            job.setLoopActive(false);
            logger.warn(
                    "Job {} reached its last segment with segment {} not completed, pausing",
                    job.getId(),
                    job.getCurrentSegmentIndex());
            return LoopStep.of(LoopAction.STOP);
        }
        job.setStatus(JobStatus.COMPLETED);
        job.setLoopActive(false);
        return LoopStep.of(LoopAction.FINISH);
    }

    private boolean processInLoop(GenerationJob job, LoopStep step, int index) {
        try {
            segmentProcessor.process(job, step.segment(), step.previous());
            segmentsCompletedCounter.increment();
            return true;
        } catch (SegmentFailureException | RuntimeException e) {
            pauseOnFailure(job, index, e);
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            pauseOnFailure(job, index, e);
            return false;
        }
    }

    private void pauseOnFailure(GenerationJob job, int index, Exception cause) {
        mainLoopFailureCounter.increment();
        pausedOnFailureCounter.increment();
        job.locked(() -> {
            job.setStatus(JobStatus.PAUSED);
            job.setCurrentSegmentIndex(index);
            job.setLoopActive(false);
        });
        logger.warn("Job {} paused at segment {} after failure: {}", job.getId(), index, cause.getMessage());
    }

    private void assembleFinalVideo(GenerationJob job) {
        List<Path> outputs = job.orderedOutputs();
        try {
            Path finalVideo = finalAssembler.assemble(job.getId(), outputs);
            job.setFinalVideoPath(finalVideo);
            logger.info("Final video for job {} written to {}", job.getId(), finalVideo);
        } catch (SegmentFailureException | RuntimeException e) {
            finalAssemblyFailureCounter.increment();
            logger.error("Final assembly failed for job {}; the job stays completed", job.getId(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            finalAssemblyFailureCounter.increment();
            logger.error("Final assembly interrupted for job {}; the job stays completed", job.getId(), e);
        }
    }

    private void runRetry(GenerationJob job, Segment segment, String key, CompletableFuture<Void> retry) {
        try {
            Segment previous = job.locked(() -> {
                int index = job.indexOf(segment.getId());
                return index < 0 ? null : job.previousCompleted(index).orElse(null);
            });
            segmentProcessor.process(job, segment, previous);
            segmentsCompletedCounter.increment();
            logger.info("Retry of segment {} in job {} completed", segment.getId(), job.getId());
        } catch (SegmentFailureException | RuntimeException e) {
            retryFailureCounter.increment();
            logger.warn("Retry of segment {} in job {} failed: {}", segment.getId(), job.getId(), e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            retryFailureCounter.increment();
            logger.warn("Retry of segment {} in job {} was interrupted", segment.getId(), job.getId());
        } finally {
            retries.remove(key);
            retry.complete(null);
        }
    }

    private Optional<CompletableFuture<Void>> pendingRetry(String jobId) {
        String prefix = jobId + "/";
        return retries.entrySet().stream()
                .filter(entry -> entry.getKey().startsWith(prefix))
                .map(Map.Entry::getValue)
                .findFirst();
    }

    private boolean hasPendingRetries(String jobId) {
        String prefix = jobId + "/";
        return retries.keySet().stream().anyMatch(key -> key.startsWith(prefix));
    }

    private boolean isBusy(GenerationJob job) {
        return job.getStatus() == JobStatus.RUNNING || job.isLoopActive();
    }

    private GenerationJob requireJob(String jobId) {
        return repository.findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
    }

    private Segment requireSegment(GenerationJob job, String segmentId) {
        return job.findSegment(segmentId).orElseThrow(() -> new SegmentNotFoundException(job.getId(), segmentId));
    }

    private static String retryKey(String jobId, String segmentId) {
        return jobId + "/" + segmentId;
    }

    private enum LoopAction {
        STOP,
        FINISH,
        SKIP,
        AWAIT_RETRY,
        PROCESS
    }

    private record LoopStep(
            LoopAction action,
            Segment segment,
            Segment previous,
            CompletableFuture<Void> retry) {

        static LoopStep of(LoopAction action) {
            return new LoopStep(action, null, null, null);
        }

        static LoopStep awaiting(CompletableFuture<Void> retry) {
            return new LoopStep(LoopAction.AWAIT_RETRY, null, null, retry);
        }
    }
}
