package github.sarthakdev143.segment_forge.controller;

import github.sarthakdev143.segment_forge.dto.CreateJobRequest;
import github.sarthakdev143.segment_forge.dto.JobActionResponse;
import github.sarthakdev143.segment_forge.dto.ResumeResponse;
import github.sarthakdev143.segment_forge.dto.RetryResponse;
import github.sarthakdev143.segment_forge.dto.SegmentLogsResponse;
import github.sarthakdev143.segment_forge.dto.SegmentUpdateRequest;
import github.sarthakdev143.segment_forge.exception.JobNotFoundException;
import github.sarthakdev143.segment_forge.exception.SegmentNotFoundException;
import github.sarthakdev143.segment_forge.model.JobSnapshot;
import github.sarthakdev143.segment_forge.model.Segment;
import github.sarthakdev143.segment_forge.model.SegmentSnapshot;
import github.sarthakdev143.segment_forge.service.JobStateMachine;
import github.sarthakdev143.segment_forge.service.impl.SegmentRequestValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.FileSystemResource;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.nio.file.Path;
import java.util.List;

@RestController
@RequestMapping("/api/jobs")
public class SegmentJobController {

    private static final Logger logger = LoggerFactory.getLogger(SegmentJobController.class);
    private static final MediaType VIDEO_MP4 = MediaType.parseMediaType("video/mp4");

    private final JobStateMachine jobStateMachine;
    private final SegmentRequestValidator requestValidator;

    public SegmentJobController(JobStateMachine jobStateMachine, SegmentRequestValidator requestValidator) {
        this.jobStateMachine = jobStateMachine;
        this.requestValidator = requestValidator;
    }

    @PostMapping
    public ResponseEntity<JobSnapshot> createJob(@RequestBody CreateJobRequest request) {
        List<Segment> segments = requestValidator.toSegments(request);
        JobSnapshot job = jobStateMachine.create(segments, request.context());
        return ResponseEntity.status(HttpStatus.CREATED).body(job);
    }

    @GetMapping("/{jobId}")
    public ResponseEntity<JobSnapshot> getJob(@PathVariable String jobId) {
        return ResponseEntity.ok(jobStateMachine.get(jobId));
    }

    @PostMapping("/{jobId}/start")
    public ResponseEntity<JobActionResponse> startJob(@PathVariable String jobId) {
        JobSnapshot job = jobStateMachine.start(jobId);
        return ResponseEntity.accepted()
                .body(new JobActionResponse(
                        job.id(),
                        job.status(),
                        job.currentSegmentIndex(),
                        "Job started. Poll /api/jobs/{jobId} for progress."));
    }

    @PostMapping("/{jobId}/pause")
    public ResponseEntity<JobActionResponse> pauseJob(@PathVariable String jobId) {
        JobSnapshot job = jobStateMachine.pause(jobId);
        return ResponseEntity.ok(new JobActionResponse(
                job.id(),
                job.status(),
                job.currentSegmentIndex(),
                "Pause requested. The segment in progress will finish first."));
    }

    @PostMapping("/{jobId}/resume")
    public ResponseEntity<ResumeResponse> resumeJob(@PathVariable String jobId) {
        int index = jobStateMachine.resume(jobId);
        JobSnapshot job = jobStateMachine.get(jobId);
        return ResponseEntity.accepted().body(new ResumeResponse(job.id(), job.status(), index));
    }

    @PostMapping("/{jobId}/resume/{index}")
    public ResponseEntity<ResumeResponse> resumeJobFrom(@PathVariable String jobId, @PathVariable int index) {
        JobSnapshot job = jobStateMachine.resumeFrom(jobId, index);
        return ResponseEntity.accepted().body(new ResumeResponse(job.id(), job.status(), index));
    }

    @PutMapping("/{jobId}/segments")
    public ResponseEntity<JobSnapshot> replaceSegments(
            @PathVariable String jobId,
            @RequestBody CreateJobRequest request) {
        List<Segment> segments = requestValidator.toSegments(request);
        return ResponseEntity.ok(jobStateMachine.replaceSegments(jobId, segments, request.context()));
    }

    @PatchMapping("/{jobId}/segments/{segmentId}")
    public ResponseEntity<SegmentSnapshot> updateSegment(
            @PathVariable String jobId,
            @PathVariable String segmentId,
            @RequestBody SegmentUpdateRequest request) {
        return ResponseEntity.ok(jobStateMachine.updateSegment(jobId, segmentId, requestValidator.toUpdate(request)));
    }

    @DeleteMapping("/{jobId}/segments/{segmentId}")
    public ResponseEntity<JobSnapshot> deleteSegment(@PathVariable String jobId, @PathVariable String segmentId) {
        return ResponseEntity.ok(jobStateMachine.deleteSegment(jobId, segmentId));
    }

    @PostMapping("/{jobId}/segments/{segmentId}/retry")
    public ResponseEntity<RetryResponse> retrySegment(@PathVariable String jobId, @PathVariable String segmentId) {
        SegmentSnapshot segment = jobStateMachine.retrySegment(jobId, segmentId);
        return ResponseEntity.accepted()
                .body(new RetryResponse(
                        jobId,
                        segment.id(),
                        segment.status(),
                        "Retry started. Poll the segment logs for progress."));
    }

    @GetMapping("/{jobId}/segments/{segmentId}/logs")
    public ResponseEntity<SegmentLogsResponse> getSegmentLogs(
            @PathVariable String jobId,
            @PathVariable String segmentId) {
        SegmentSnapshot segment = jobStateMachine.getSegment(jobId, segmentId);
        return ResponseEntity.ok(new SegmentLogsResponse(
                segment.id(),
                segment.status(),
                segment.error(),
                segment.generatedScript(),
                segment.logs()));
    }

    @GetMapping("/{jobId}/segments/{segmentId}/video")
    public ResponseEntity<?> getSegmentVideo(@PathVariable String jobId, @PathVariable String segmentId) {
        return jobStateMachine.segmentVideo(jobId, segmentId)
                .<ResponseEntity<?>>map(path -> videoResponse(path, null))
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND)
                        .body("Video not available for segment: " + segmentId));
    }

    @GetMapping("/{jobId}/final-video")
    public ResponseEntity<?> getFinalVideo(@PathVariable String jobId) {
        return jobStateMachine.finalVideo(jobId)
                .<ResponseEntity<?>>map(path -> videoResponse(path, "final_" + jobId + ".mp4"))
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND)
                        .body("Final video not available for job: " + jobId));
    }

    @ExceptionHandler({JobNotFoundException.class, SegmentNotFoundException.class})
    public ResponseEntity<String> handleNotFound(RuntimeException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(e.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<String> handleInvalidRequest(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body("Invalid request: " + e.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<String> handleUnreadableBody(HttpMessageNotReadableException e) {
        return ResponseEntity.badRequest().body("Invalid request: body is not valid JSON for this endpoint.");
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<String> handleConflict(IllegalStateException e) {
        logger.info("Rejected job request: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(e.getMessage());
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<String> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
        return ResponseEntity.badRequest().body("Invalid request: " + e.getName() + " has an invalid value.");
    }

    private ResponseEntity<FileSystemResource> videoResponse(Path path, String downloadName) {
        ResponseEntity.BodyBuilder response = ResponseEntity.ok().contentType(VIDEO_MP4);
        if (downloadName != null) {
            response.header(
                    HttpHeaders.CONTENT_DISPOSITION,
                    ContentDisposition.attachment().filename(downloadName).build().toString());
        }
        return response.body(new FileSystemResource(path));
    }
}
