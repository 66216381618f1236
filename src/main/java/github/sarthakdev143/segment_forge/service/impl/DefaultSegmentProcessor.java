package github.sarthakdev143.segment_forge.service.impl;

import github.sarthakdev143.segment_forge.config.SegmentForgeProperties;
import github.sarthakdev143.segment_forge.exception.ScriptExecutionException;
import github.sarthakdev143.segment_forge.exception.SegmentFailureException;
import github.sarthakdev143.segment_forge.integration.media.MediaProbe;
import github.sarthakdev143.segment_forge.integration.render.VisualRenderer;
import github.sarthakdev143.segment_forge.integration.speech.SpeechSynthesizer;
import github.sarthakdev143.segment_forge.model.ClipPlan;
import github.sarthakdev143.segment_forge.model.GenerationJob;
import github.sarthakdev143.segment_forge.model.Segment;
import github.sarthakdev143.segment_forge.model.SegmentType;
import github.sarthakdev143.segment_forge.model.SpeechResult;
import github.sarthakdev143.segment_forge.model.VoiceoverConfig;
import github.sarthakdev143.segment_forge.model.render.RenderOutcome;
import github.sarthakdev143.segment_forge.model.render.RenderRequest;
import github.sarthakdev143.segment_forge.model.visual.VisualSpec;
import github.sarthakdev143.segment_forge.service.ClipEditor;
import github.sarthakdev143.segment_forge.service.DurationMatcher;
import github.sarthakdev143.segment_forge.service.SegmentProcessor;
import github.sarthakdev143.segment_forge.service.TransitionComposer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Per-segment pipeline: narration, visual, duration reconciliation, then audio/video mux.
 * <p>
 * Segment state is only touched under the job lock; renderer, speech and ffmpeg calls run
 * without it.
 */
@Service
public class DefaultSegmentProcessor implements SegmentProcessor {

    private static final Logger logger = LoggerFactory.getLogger(DefaultSegmentProcessor.class);

    /** Prefixes rotated across chunked clips so consecutive clips do not repeat the same shot. */
    static final List<String> PERSPECTIVES = List.of(
            "",
            "Show this from a different angle. ",
            "Zoom in on a key detail. ",
            "Pull back to show the broader context. ",
            "Focus on the most visually interesting element. ");

    private final SpeechSynthesizer speechSynthesizer;
    private final VisualRenderer visualRenderer;
    private final TransitionComposer transitionComposer;
    private final DurationMatcher durationMatcher;
    private final ClipEditor clipEditor;
    private final MediaProbe mediaProbe;
    private final SegmentForgeProperties.Pipeline pipeline;

    public DefaultSegmentProcessor(
            SpeechSynthesizer speechSynthesizer,
            VisualRenderer visualRenderer,
            TransitionComposer transitionComposer,
            DurationMatcher durationMatcher,
            ClipEditor clipEditor,
            MediaProbe mediaProbe,
            SegmentForgeProperties properties) {
        this.speechSynthesizer = speechSynthesizer;
        this.visualRenderer = visualRenderer;
        this.transitionComposer = transitionComposer;
        this.durationMatcher = durationMatcher;
        this.clipEditor = clipEditor;
        this.mediaProbe = mediaProbe;
        this.pipeline = properties.pipeline();
    }

    @Override
    public void process(GenerationJob job, Segment segment, Segment previousCompleted)
            throws SegmentFailureException, InterruptedException {
        SegmentInput input = job.locked(() -> {
            segment.markProcessing();
            segment.addLog("Processing started.");
            return new SegmentInput(
                    segment.getTitle(),
                    segment.getDescription(),
                    segment.getVoiceover(),
                    segment.getVisualSpec(),
                    buildRetryContext(segment));
        });
        Path previousOutput = previousCompleted == null ? null : job.locked(previousCompleted::outputPath);

        try {
            Path audio = null;
            double targetSeconds = pipeline.defaultSegmentSeconds();
            if (input.voiceover() != null) {
                SpeechResult speech = speechSynthesizer.synthesize(input.voiceover());
                audio = speech.audioPath();
                targetSeconds = speech.durationSeconds();
                Path audioPath = audio;
                double narrationSeconds = targetSeconds;
                job.locked(() -> {
                    segment.setAudioPath(audioPath);
                    segment.setDurationSeconds(narrationSeconds);
                    segment.addLog("Narration ready: " + audioPath + " (" + formatSeconds(narrationSeconds) + "s)");
                });
            } else {
                double defaultSeconds = targetSeconds;
                job.locked(() -> {
                    segment.setDurationSeconds(defaultSeconds);
                    segment.addLog("No voiceover, using default duration of " + formatSeconds(defaultSeconds) + "s.");
                });
            }

            SegmentType type = input.spec().type();
            if (type == SegmentType.TRANSITION) {
                composeTransition(job, segment, input, audio, targetSeconds, previousOutput);
                return;
            }

            Path video = type.requiresChunking()
                    ? renderChunked(job, segment, input, targetSeconds)
                    : renderScripted(job, segment, input, targetSeconds);
            recordVideo(job, segment, video, "Visual generated: " + video);

            double videoSeconds = mediaProbe.durationSeconds(video);
            double target = targetSeconds;
            if (Math.abs(videoSeconds - target) > pipeline.durationToleranceSeconds()) {
                job.locked(() -> segment.addLog(
                        "Visual runs " + formatSeconds(videoSeconds) + "s, retiming to " + formatSeconds(target) + "s."));
                video = durationMatcher.match(video, target);
                recordVideo(job, segment, video, "Visual retimed: " + video);
            }

            Path combined = audio == null ? video : clipEditor.combine(video, audio);
            job.locked(() -> {
                segment.setCombinedPath(combined);
                segment.addLog("Segment output ready: " + combined);
                segment.markCompleted();
            });
            logger.info("Segment {} of job {} completed", segment.getId(), job.getId());
        } catch (ScriptExecutionException e) {
            job.locked(() -> segment.setGeneratedScript(e.getScript()));
            fail(job, segment, e.getMessage(), e);
            throw e;
        } catch (SegmentFailureException | RuntimeException e) {
            fail(job, segment, e.getMessage(), e);
            throw e;
        } catch (InterruptedException e) {
            fail(job, segment, "Processing was interrupted.", e);
            throw e;
        }
    }

    private void composeTransition(
            GenerationJob job,
            Segment segment,
            SegmentInput input,
            Path audio,
            double targetSeconds,
            Path previousOutput) throws SegmentFailureException, InterruptedException {
        if (audio == null) {
            throw new SegmentFailureException("Transition segments require a voiceover.");
        }

        job.locked(() -> segment.addLog(previousOutput == null
                ? "No previous segment output, using a black background."
                : "Using last frame of " + previousOutput + " as background."));
        Path output = transitionComposer.compose(
                input.title(),
                input.description(),
                audio,
                targetSeconds,
                previousOutput);
        job.locked(() -> {
            segment.setVideoPath(output);
            segment.setCombinedPath(output);
            segment.addLog("Transition composed: " + output);
            segment.markCompleted();
        });
        logger.info("Transition segment {} of job {} completed", segment.getId(), job.getId());
    }

    private Path renderScripted(GenerationJob job, Segment segment, SegmentInput input, double targetSeconds)
            throws SegmentFailureException {
        RenderRequest request = new RenderRequest(
                input.spec().type(),
                input.title(),
                input.description(),
                targetSeconds,
                input.spec(),
                null,
                input.retryContext());

        if (input.spec().type().supportsScriptPreview()) {
            String script = visualRenderer.generateScript(request);
            job.locked(() -> {
                segment.setGeneratedScript(script);
                segment.addLog("Script preview ready (" + script.length() + " chars).");
            });
            request = request.withScript(script);
        }

        return requireRendered(job, segment, visualRenderer.render(request));
    }

    private Path renderChunked(GenerationJob job, Segment segment, SegmentInput input, double targetSeconds)
            throws SegmentFailureException, InterruptedException {
        ClipPlan plan = ClipPlan.forTarget(targetSeconds, pipeline.minClipSeconds(), pipeline.maxClipSeconds());
        job.locked(() -> segment.addLog(
                "Rendering " + plan.clipCount() + " clip(s) of " + formatSeconds(plan.clipSeconds()) + "s."));

        List<Path> clips = new ArrayList<>();
        for (int index = 0; index < plan.clipCount(); index++) {
            RenderRequest request = new RenderRequest(
                    input.spec().type(),
                    input.title(),
                    PERSPECTIVES.get(index % PERSPECTIVES.size()) + input.description(),
                    plan.clipSeconds(),
                    input.spec(),
                    null,
                    input.retryContext());
            Path clip = requireRendered(job, segment, visualRenderer.render(request));
            clips.add(clip);
            int clipNumber = index + 1;
            job.locked(() -> segment.addLog("Clip " + clipNumber + "/" + plan.clipCount() + " rendered: " + clip));
        }

        if (clips.size() == 1) {
            return clips.get(0);
        }
        Path merged = clipEditor.mergeWithCrossfade(clips);
        job.locked(() -> segment.addLog("Merged " + clips.size() + " clips with crossfades."));
        return merged;
    }

    private Path requireRendered(GenerationJob job, Segment segment, RenderOutcome outcome)
            throws ScriptExecutionException {
        if (outcome instanceof RenderOutcome.ScriptOnly scriptOnly) {
            throw new ScriptExecutionException(
                    "Script execution failed: " + scriptOnly.error(),
                    scriptOnly.script());
        }

        RenderOutcome.Rendered rendered = (RenderOutcome.Rendered) outcome;
        if (rendered.scriptUsed() != null) {
            job.locked(() -> segment.setGeneratedScript(rendered.scriptUsed()));
        }
        return rendered.videoPath();
    }

    private void recordVideo(GenerationJob job, Segment segment, Path video, String message) {
        job.locked(() -> {
            segment.setVideoPath(video);
            segment.addLog(message);
        });
    }

    private void fail(GenerationJob job, Segment segment, String message, Exception cause) {
        String error = message == null || message.isBlank() ? cause.getClass().getSimpleName() : message;
        job.locked(() -> {
            segment.addLog("Failed: " + error);
            segment.markFailed(error);
        });
        logger.error("Segment {} of job {} failed", segment.getId(), job.getId(), cause);
    }

    /**
     * Error and script of the previous failed attempt, sent along so the backend can correct itself.
     */
    private String buildRetryContext(Segment segment) {
        String previousError = segment.getPreviousError();
        if (previousError == null) {
            return null;
        }
        String previousScript = segment.getGeneratedScript();
        if (previousScript == null || previousScript.isBlank()) {
            return previousError;
        }
        return previousError + "\n\nPrevious script:\n" + previousScript;
    }

    private String formatSeconds(double seconds) {
        return String.format(Locale.ROOT, "%.2f", seconds);
    }

    private record SegmentInput(
            String title,
            String description,
            VoiceoverConfig voiceover,
            VisualSpec spec,
            String retryContext) {
    }
}
