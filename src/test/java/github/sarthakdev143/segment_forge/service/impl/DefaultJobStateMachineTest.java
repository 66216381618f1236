package github.sarthakdev143.segment_forge.service.impl;

import github.sarthakdev143.segment_forge.exception.JobNotFoundException;
import github.sarthakdev143.segment_forge.exception.MediaToolException;
import github.sarthakdev143.segment_forge.exception.SegmentFailureException;
import github.sarthakdev143.segment_forge.exception.SegmentNotFoundException;
import github.sarthakdev143.segment_forge.model.GenerationJob;
import github.sarthakdev143.segment_forge.model.JobSnapshot;
import github.sarthakdev143.segment_forge.model.JobStatus;
import github.sarthakdev143.segment_forge.model.Segment;
import github.sarthakdev143.segment_forge.model.SegmentSnapshot;
import github.sarthakdev143.segment_forge.model.SegmentStatus;
import github.sarthakdev143.segment_forge.model.SegmentUpdate;
import github.sarthakdev143.segment_forge.model.VoiceoverConfig;
import github.sarthakdev143.segment_forge.model.visual.AnimationSpec;
import github.sarthakdev143.segment_forge.model.visual.ManimSpec;
import github.sarthakdev143.segment_forge.model.visual.TransitionSpec;
import github.sarthakdev143.segment_forge.repository.InMemorySegmentJobRepository;
import github.sarthakdev143.segment_forge.service.FinalAssembler;
import github.sarthakdev143.segment_forge.service.SegmentProcessor;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DefaultJobStateMachineTest {

    @Mock
    private SegmentProcessor segmentProcessor;

    @Mock
    private FinalAssembler finalAssembler;

    private SimpleMeterRegistry meterRegistry;
    private DefaultJobStateMachine stateMachine;
    private ExecutorService pool;
    private ThreadPoolTaskExecutor singleThreadExecutor;
    private final Set<String> failingTitles = ConcurrentHashMap.newKeySet();
    private final List<String> processedTitles = new ArrayList<>();

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        TaskExecutor directExecutor = Runnable::run;
        stateMachine = newStateMachine(directExecutor);
    }

    @AfterEach
    void tearDown() {
        if (pool != null) {
            pool.shutdownNow();
        }
        if (singleThreadExecutor != null) {
            singleThreadExecutor.shutdown();
        }
    }

    @Test
    void startProcessesEverySegmentAndAssemblesFinalVideoInOrder() throws Exception {
        processSegmentsSuccessfully();
        when(finalAssembler.assemble(anyString(), anyList())).thenReturn(Path.of("final/final.mp4"));
        JobSnapshot created = stateMachine.create(segments("Intro", "Middle", "Outro"), "physics");

        stateMachine.start(created.id());

        JobSnapshot job = stateMachine.get(created.id());
        assertThat(job.status()).isEqualTo(JobStatus.COMPLETED);
        assertThat(job.finalVideoPath()).isEqualTo(Path.of("final/final.mp4").toString());
        assertThat(job.segments()).extracting(SegmentSnapshot::status).containsOnly(SegmentStatus.COMPLETED);
        assertThat(processedTitles).containsExactly("Intro", "Middle", "Outro");
        verify(finalAssembler).assemble(created.id(), List.of(
                Path.of("Intro.mp4"), Path.of("Middle.mp4"), Path.of("Outro.mp4")));
        assertThat(meterRegistry.counter("segment_forge.segments.completed").count()).isEqualTo(3.0);
        assertThat(meterRegistry.counter("segment_forge.jobs.completed").count()).isEqualTo(1.0);
    }

    @Test
    void segmentFailurePausesJobAtFailedIndex() throws Exception {
        processSegmentsSuccessfully();
        failingTitles.add("Middle");
        JobSnapshot created = stateMachine.create(segments("Intro", "Middle", "Outro"), null);

        stateMachine.start(created.id());

        JobSnapshot job = stateMachine.get(created.id());
        assertThat(job.status()).isEqualTo(JobStatus.PAUSED);
        assertThat(job.currentSegmentIndex()).isEqualTo(1);
        assertThat(job.segments()).extracting(SegmentSnapshot::status)
                .containsExactly(SegmentStatus.COMPLETED, SegmentStatus.FAILED, SegmentStatus.PENDING);
        assertThat(job.segments().get(1).error()).isEqualTo("render failed for Middle");
        verify(finalAssembler, never()).assemble(anyString(), anyList());
        assertThat(meterRegistry.counter("segment_forge.segments.failed", "phase", "main_loop").count()).isEqualTo(1.0);
        assertThat(meterRegistry.counter("segment_forge.jobs.paused_on_failure").count()).isEqualTo(1.0);
    }

    @Test
    void resumeContinuesFromFirstIncompleteSegment() throws Exception {
        processSegmentsSuccessfully();
        failingTitles.add("Middle");
        when(finalAssembler.assemble(anyString(), anyList())).thenReturn(Path.of("final/final.mp4"));
        List<Segment> segments = segments("Intro", "Middle", "Outro");
        JobSnapshot created = stateMachine.create(segments, null);
        stateMachine.start(created.id());
        failingTitles.clear();

        int resumedFrom = stateMachine.resume(created.id());

        assertThat(resumedFrom).isEqualTo(1);
        assertThat(stateMachine.get(created.id()).status()).isEqualTo(JobStatus.COMPLETED);
        assertThat(processedTitles).containsExactly("Intro", "Middle", "Middle", "Outro");
        verify(segmentProcessor, times(2)).process(any(GenerationJob.class), eq(segments.get(1)), eq(segments.get(0)));
    }

    @Test
    void retrySegmentReprocessesOnlyThatSegment() throws Exception {
        processSegmentsSuccessfully();
        failingTitles.add("Middle");
        JobSnapshot created = stateMachine.create(segments("Intro", "Middle", "Outro"), null);
        stateMachine.start(created.id());
        failingTitles.clear();
        String middleId = created.segments().get(1).id();

        SegmentSnapshot retried = stateMachine.retrySegment(created.id(), middleId);

        assertThat(retried.status()).isEqualTo(SegmentStatus.PROCESSING);
        JobSnapshot job = stateMachine.get(created.id());
        assertThat(job.status()).isEqualTo(JobStatus.PAUSED);
        assertThat(job.currentSegmentIndex()).isEqualTo(1);
        assertThat(job.segments()).extracting(SegmentSnapshot::status)
                .containsExactly(SegmentStatus.COMPLETED, SegmentStatus.COMPLETED, SegmentStatus.PENDING);
        assertThat(processedTitles).containsExactly("Intro", "Middle", "Middle");
    }

    @Test
    void failedRetryIsCountedAndLeavesJobStatusAlone() throws Exception {
        processSegmentsSuccessfully();
        failingTitles.add("Middle");
        JobSnapshot created = stateMachine.create(segments("Intro", "Middle"), null);
        stateMachine.start(created.id());
        String middleId = created.segments().get(1).id();

        stateMachine.retrySegment(created.id(), middleId);

        JobSnapshot job = stateMachine.get(created.id());
        assertThat(job.status()).isEqualTo(JobStatus.PAUSED);
        assertThat(job.segments().get(1).status()).isEqualTo(SegmentStatus.FAILED);
        assertThat(meterRegistry.counter("segment_forge.segments.failed", "phase", "retry").count()).isEqualTo(1.0);
    }

    @Test
    void pauseStopsLoopBeforeNextSegment() throws Exception {
        List<Segment> segments = segments("Intro", "Middle", "Outro");
        JobSnapshot created = stateMachine.create(segments, null);
        doAnswer(invocation -> {
            GenerationJob job = invocation.getArgument(0);
            Segment segment = invocation.getArgument(1);
            stateMachine.pause(job.getId());
            complete(job, segment);
            return null;
        }).when(segmentProcessor).process(any(GenerationJob.class), eq(segments.get(0)), isNull());

        stateMachine.start(created.id());

        JobSnapshot job = stateMachine.get(created.id());
        assertThat(job.status()).isEqualTo(JobStatus.PAUSED);
        assertThat(job.currentSegmentIndex()).isEqualTo(1);
        assertThat(job.segments()).extracting(SegmentSnapshot::status)
                .containsExactly(SegmentStatus.COMPLETED, SegmentStatus.PENDING, SegmentStatus.PENDING);
    }

    @Test
    void finalAssemblyFailureKeepsJobCompleted() throws Exception {
        processSegmentsSuccessfully();
        when(finalAssembler.assemble(anyString(), anyList()))
                .thenThrow(new MediaToolException("final assembly", 1, "Invalid data found"));
        JobSnapshot created = stateMachine.create(segments("Intro", "Outro"), null);

        stateMachine.start(created.id());

        JobSnapshot job = stateMachine.get(created.id());
        assertThat(job.status()).isEqualTo(JobStatus.COMPLETED);
        assertThat(job.finalVideoPath()).isNull();
        assertThat(stateMachine.finalVideo(created.id())).isEmpty();
        assertThat(meterRegistry.counter("segment_forge.final_assembly.failures").count()).isEqualTo(1.0);
    }

    @Test
    void runningJobRejectsStructuralEditsAndDuplicateRetries() throws Exception {
        List<Segment> segments = segments("Intro", "Outro");
        JobSnapshot created = stateMachine.create(segments, null);
        String jobId = created.id();
        String introId = segments.get(0).getId();
        String outroId = segments.get(1).getId();
        List<Throwable> rejections = new ArrayList<>();
        doAnswer(invocation -> {
            GenerationJob job = invocation.getArgument(0);
            Segment segment = invocation.getArgument(1);
            if (segment == segments.get(0)) {
                rejections.add(catchRejection(() -> stateMachine.deleteSegment(jobId, outroId)));
                rejections.add(catchRejection(() -> stateMachine.retrySegment(jobId, introId)));
                rejections.add(catchRejection(() -> stateMachine.updateSegment(
                        jobId, introId, new SegmentUpdate("New title", null, null, null, null))));
                rejections.add(catchRejection(() -> stateMachine.replaceSegments(jobId, segments("Other"), null)));
                rejections.add(catchRejection(() -> stateMachine.resumeFrom(jobId, 0)));
            }
            complete(job, segment);
            return null;
        }).when(segmentProcessor).process(any(GenerationJob.class), any(Segment.class), any());
        when(finalAssembler.assemble(anyString(), anyList())).thenReturn(Path.of("final/final.mp4"));

        stateMachine.start(jobId);

        assertThat(rejections).hasSize(5).allSatisfy(error -> assertThat(error).isInstanceOf(IllegalStateException.class));
        assertThat(rejections.get(0)).hasMessageContaining("Pause job " + jobId + " before deleting segments.");
        assertThat(rejections.get(1)).hasMessageContaining("is already being processed.");
        assertThat(stateMachine.get(jobId).status()).isEqualTo(JobStatus.COMPLETED);
        assertThat(stateMachine.get(jobId).segments()).hasSize(2);
    }

    @Test
    void startRequiresIdleJob() throws Exception {
        processSegmentsSuccessfully();
        when(finalAssembler.assemble(anyString(), anyList())).thenReturn(Path.of("final/final.mp4"));
        JobSnapshot created = stateMachine.create(segments("Intro"), null);
        stateMachine.start(created.id());

        assertThatThrownBy(() -> stateMachine.start(created.id()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("can only be started while idle");
        assertThatThrownBy(() -> stateMachine.pause(created.id()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("already completed");
    }

    @Test
    void resumeFromRejectsIndexOutOfRange() {
        JobSnapshot created = stateMachine.create(segments("Intro", "Outro"), null);

        assertThatThrownBy(() -> stateMachine.resumeFrom(created.id(), 2))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("between 0 and 1");
    }

    @Test
    void finalVideoRequiresCompletedJob() {
        JobSnapshot created = stateMachine.create(segments("Intro"), null);

        assertThatThrownBy(() -> stateMachine.finalVideo(created.id()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("is not completed");
    }

    @Test
    void unknownIdsAreReportedAsNotFound() {
        JobSnapshot created = stateMachine.create(segments("Intro"), null);

        assertThatThrownBy(() -> stateMachine.get("missing"))
                .isInstanceOf(JobNotFoundException.class)
                .hasMessage("Job not found: missing");
        assertThatThrownBy(() -> stateMachine.getSegment(created.id(), "missing"))
                .isInstanceOf(SegmentNotFoundException.class);
    }

    @Test
    void updateSegmentResetsOutputsAndReorders() throws Exception {
        processSegmentsSuccessfully();
        failingTitles.add("Outro");
        List<Segment> segments = segments("Intro", "Middle", "Outro");
        JobSnapshot created = stateMachine.create(segments, null);
        stateMachine.start(created.id());

        SegmentSnapshot updated = stateMachine.updateSegment(
                created.id(),
                segments.get(0).getId(),
                new SegmentUpdate("Opening", null, new ManimSpec("chalkboard", false), null, 2));

        assertThat(updated.status()).isEqualTo(SegmentStatus.PENDING);
        assertThat(updated.combinedPath()).isNull();
        assertThat(updated.title()).isEqualTo("Opening");
        assertThat(updated.order()).isEqualTo(2);
        assertThat(stateMachine.get(created.id()).segments()).extracting(SegmentSnapshot::title)
                .containsExactly("Middle", "Outro", "Opening");
    }

    @Test
    void updateSegmentRejectsTransitionWithoutVoiceover() {
        Segment silent = new Segment("Title card", "A silent title card", null, new AnimationSpec(null));
        JobSnapshot created = stateMachine.create(List.of(silent), null);

        assertThatThrownBy(() -> stateMachine.updateSegment(
                created.id(),
                silent.getId(),
                new SegmentUpdate(null, null, new TransitionSpec(false), null, null)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("require a voiceover");
    }

    @Test
    void deleteSegmentRenumbersWhilePaused() throws Exception {
        processSegmentsSuccessfully();
        failingTitles.add("Middle");
        List<Segment> segments = segments("Intro", "Middle", "Outro");
        JobSnapshot created = stateMachine.create(segments, null);
        stateMachine.start(created.id());

        JobSnapshot job = stateMachine.deleteSegment(created.id(), segments.get(1).getId());

        assertThat(job.segments()).extracting(SegmentSnapshot::title).containsExactly("Intro", "Outro");
        assertThat(job.segments()).extracting(SegmentSnapshot::order).containsExactly(0, 1);
    }

    @Test
    void replaceSegmentsReturnsJobToIdle() throws Exception {
        processSegmentsSuccessfully();
        failingTitles.add("Intro");
        JobSnapshot created = stateMachine.create(segments("Intro"), null);
        stateMachine.start(created.id());

        JobSnapshot replaced = stateMachine.replaceSegments(created.id(), segments("A", "B"), "new context");

        assertThat(replaced.status()).isEqualTo(JobStatus.IDLE);
        assertThat(replaced.context()).isEqualTo("new context");
        assertThat(replaced.segments()).extracting(SegmentSnapshot::status)
                .containsOnly(SegmentStatus.PENDING);
    }

    @Test
    void loopWaitsForInFlightRetryInsteadOfProcessingSegmentTwice() throws Exception {
        pool = Executors.newFixedThreadPool(2);
        TaskExecutor poolExecutor = pool::execute;
        stateMachine = newStateMachine(poolExecutor);
        List<Segment> segments = segments("Intro", "Middle", "Outro");
        CountDownLatch retryStarted = new CountDownLatch(1);
        CountDownLatch releaseRetry = new CountDownLatch(1);
        Set<String> failOnce = ConcurrentHashMap.newKeySet();
        failOnce.add("Middle");
        Set<String> blockRetry = ConcurrentHashMap.newKeySet();
        doAnswer(invocation -> {
            GenerationJob job = invocation.getArgument(0);
            Segment segment = invocation.getArgument(1);
            if (failOnce.remove(segment.getTitle())) {
                job.locked(() -> segment.markFailed("first attempt failed"));
                blockRetry.add(segment.getTitle());
                throw new SegmentFailureException("first attempt failed");
            }
            if (blockRetry.remove(segment.getTitle())) {
                retryStarted.countDown();
                releaseRetry.await(5, TimeUnit.SECONDS);
            }
            complete(job, segment);
            return null;
        }).when(segmentProcessor).process(any(GenerationJob.class), any(Segment.class), any());
        when(finalAssembler.assemble(anyString(), anyList())).thenReturn(Path.of("final/final.mp4"));
        JobSnapshot created = stateMachine.create(segments, null);
        String jobId = created.id();

        stateMachine.start(jobId);
        awaitCondition(() -> stateMachine.get(jobId).status() == JobStatus.PAUSED);
        stateMachine.retrySegment(jobId, segments.get(1).getId());
        assertThat(retryStarted.await(5, TimeUnit.SECONDS)).isTrue();
        int resumedFrom = stateMachine.resume(jobId);
        releaseRetry.countDown();
        awaitCondition(() -> stateMachine.get(jobId).finalVideoPath() != null);

        assertThat(resumedFrom).isEqualTo(1);
        verify(segmentProcessor, times(2)).process(any(GenerationJob.class), eq(segments.get(1)), any());
        verify(segmentProcessor, times(1)).process(any(GenerationJob.class), eq(segments.get(2)), any());
        assertThat(stateMachine.get(jobId).segments()).extracting(SegmentSnapshot::status)
                .containsOnly(SegmentStatus.COMPLETED);
    }

    @Test
    void retryQueuedBehindLoopOnSingleThreadCompletesJob() throws Exception {
        singleThreadExecutor = new ThreadPoolTaskExecutor();
        singleThreadExecutor.setCorePoolSize(1);
        singleThreadExecutor.setMaxPoolSize(1);
        singleThreadExecutor.initialize();
        stateMachine = newStateMachine(singleThreadExecutor);
        List<Segment> segments = segments("Intro", "Middle", "Outro");
        CountDownLatch introStarted = new CountDownLatch(1);
        CountDownLatch releaseIntro = new CountDownLatch(1);
        doAnswer(invocation -> {
            GenerationJob job = invocation.getArgument(0);
            Segment segment = invocation.getArgument(1);
            if (segment == segments.get(0)) {
                introStarted.countDown();
                releaseIntro.await(5, TimeUnit.SECONDS);
            }
            complete(job, segment);
            return null;
        }).when(segmentProcessor).process(any(GenerationJob.class), any(Segment.class), any());
        when(finalAssembler.assemble(anyString(), anyList())).thenReturn(Path.of("final/final.mp4"));
        JobSnapshot created = stateMachine.create(segments, null);
        String jobId = created.id();

        stateMachine.start(jobId);
        assertThat(introStarted.await(5, TimeUnit.SECONDS)).isTrue();
        stateMachine.retrySegment(jobId, segments.get(1).getId());
        releaseIntro.countDown();
        awaitCondition(() -> stateMachine.get(jobId).finalVideoPath() != null);

        JobSnapshot job = stateMachine.get(jobId);
        assertThat(job.status()).isEqualTo(JobStatus.COMPLETED);
        assertThat(job.segments()).extracting(SegmentSnapshot::status).containsOnly(SegmentStatus.COMPLETED);
        verify(segmentProcessor, times(1)).process(any(GenerationJob.class), eq(segments.get(1)), any());
    }

    @Test
    void startIsRejectedWhenExecutorHasNoCapacity() {
        TaskExecutor saturated = task -> {
            throw new TaskRejectedException("no idle thread");
        };
        stateMachine = newStateMachine(saturated);
        JobSnapshot created = stateMachine.create(segments("Intro"), null);

        assertThatThrownBy(() -> stateMachine.start(created.id()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Too many jobs and retries are running");
        JobSnapshot job = stateMachine.get(created.id());
        assertThat(job.status()).isEqualTo(JobStatus.IDLE);
        assertThatThrownBy(() -> stateMachine.start(created.id()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Too many jobs");
    }

    private DefaultJobStateMachine newStateMachine(TaskExecutor executor) {
        return new DefaultJobStateMachine(
                new InMemorySegmentJobRepository(),
                segmentProcessor,
                finalAssembler,
                executor,
                meterRegistry);
    }

    private void processSegmentsSuccessfully() throws Exception {
        doAnswer(invocation -> {
            GenerationJob job = invocation.getArgument(0);
            Segment segment = invocation.getArgument(1);
            processedTitles.add(segment.getTitle());
            if (failingTitles.contains(segment.getTitle())) {
                String error = "render failed for " + segment.getTitle();
                job.locked(() -> segment.markFailed(error));
                throw new SegmentFailureException(error);
            }
            complete(job, segment);
            return null;
        }).when(segmentProcessor).process(any(GenerationJob.class), any(Segment.class), any());
    }

    private static void complete(GenerationJob job, Segment segment) {
        job.locked(() -> {
            segment.setCombinedPath(Path.of(segment.getTitle() + ".mp4"));
            segment.markCompleted();
        });
    }

    private static Throwable catchRejection(Runnable action) {
        try {
            action.run();
            return null;
        } catch (RuntimeException e) {
            return e;
        }
    }

    private static void awaitCondition(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("Condition not met within 5 seconds");
            }
            Thread.sleep(10);
        }
    }

    private static List<Segment> segments(String... titles) {
        List<Segment> segments = new ArrayList<>();
        for (String title : titles) {
            segments.add(new Segment(
                    title,
                    "Description of " + title,
                    new VoiceoverConfig("Narration for " + title, null, 0.0),
                    new AnimationSpec(null)));
        }
        return segments;
    }
}
