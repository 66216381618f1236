package github.sarthakdev143.segment_forge.integration.video;

import github.sarthakdev143.segment_forge.config.SegmentForgeProperties;
import github.sarthakdev143.segment_forge.exception.ScriptExecutionException;
import github.sarthakdev143.segment_forge.exception.SegmentFailureException;
import github.sarthakdev143.segment_forge.integration.media.MediaCommandRunner;
import github.sarthakdev143.segment_forge.integration.media.MediaWorkspace;
import github.sarthakdev143.segment_forge.integration.render.VisualRenderer;
import github.sarthakdev143.segment_forge.model.OutputPreset;
import github.sarthakdev143.segment_forge.model.SegmentType;
import github.sarthakdev143.segment_forge.model.render.RenderOutcome;
import github.sarthakdev143.segment_forge.model.render.RenderRequest;
import github.sarthakdev143.segment_forge.model.visual.TransitionSpec;
import github.sarthakdev143.segment_forge.service.ClipEditor;
import github.sarthakdev143.segment_forge.service.TransitionComposer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Composes transition clips: the previous segment's last frame dimmed behind a soundwave overlay
 * that follows the narration.
 * <p>
 * Fade factors are evaluated on a 1x1 source and scaled up with nearest-neighbour sampling, so
 * ffmpeg computes one expression per frame instead of one per pixel.
 */
@Component
public class FfmpegTransitionComposer implements TransitionComposer {

    private static final Logger logger = LoggerFactory.getLogger(FfmpegTransitionComposer.class);
    private static final String OVERLAY_TEMPLATE = "templates/soundwave_scene.py";
    private static final double BACKGROUND_FADE_IN_SECONDS = 0.5;
    private static final double OVERLAY_FADE_IN_SECONDS = 0.4;
    private static final double FADE_OUT_SECONDS = 0.5;
    private static final double BACKGROUND_HOLD_OPACITY = 0.3;
    private static final double MANIM_FRAME_UNITS = 9.0;

    private final MediaCommandRunner commandRunner;
    private final MediaWorkspace workspace;
    private final ClipEditor clipEditor;
    private final VisualRenderer visualRenderer;
    private final String ffmpegBinary;
    private final OutputPreset preset;
    private final int fps;
    private final String overlayTemplate;

    public FfmpegTransitionComposer(
            MediaCommandRunner commandRunner,
            MediaWorkspace workspace,
            ClipEditor clipEditor,
            VisualRenderer visualRenderer,
            SegmentForgeProperties properties) {
        this.commandRunner = commandRunner;
        this.workspace = workspace;
        this.clipEditor = clipEditor;
        this.visualRenderer = visualRenderer;
        this.ffmpegBinary = properties.media().ffmpegBinary();
        this.preset = properties.output().preset();
        this.fps = properties.output().fps();
        this.overlayTemplate = loadTemplate();
    }

    @Override
    public Path compose(String title, String description, Path narration, double durationSeconds, Path previousOutput)
            throws SegmentFailureException, InterruptedException {
        if (narration == null) {
            throw new IllegalArgumentException("Transition segments require narration audio.");
        }

        Path background = resolveBackground(previousOutput);
        Path overlay = renderOverlay(title, description, narration, durationSeconds);
        Path output = workspace.newFile(MediaWorkspace.TRANSITIONS, "transition", ".mp4");

        commandRunner.run(
                buildCompositionCommand(background, overlay, narration, durationSeconds, output),
                "compose transition");
        return output;
    }

    private Path resolveBackground(Path previousOutput) throws SegmentFailureException, InterruptedException {
        if (previousOutput != null && Files.isRegularFile(previousOutput)) {
            try {
                return clipEditor.extractLastFrame(previousOutput);
            } catch (SegmentFailureException e) {
                logger.warn("Could not take last frame of {}, using a black background", previousOutput, e);
            }
        }
        return clipEditor.blackFrame();
    }

    private Path renderOverlay(String title, String description, Path narration, double durationSeconds)
            throws SegmentFailureException {
        RenderRequest request = new RenderRequest(
                SegmentType.TRANSITION,
                title,
                description,
                durationSeconds,
                new TransitionSpec(false),
                buildOverlayScript(narration, durationSeconds),
                null);

        RenderOutcome outcome = visualRenderer.render(request);
        if (outcome instanceof RenderOutcome.ScriptOnly scriptOnly) {
            throw new ScriptExecutionException("Soundwave overlay failed: " + scriptOnly.error(), scriptOnly.script());
        }
        return ((RenderOutcome.Rendered) outcome).videoPath();
    }

    String buildOverlayScript(Path narration, double durationSeconds) {
        double shortSide = Math.min(preset.width(), preset.height());
        return overlayTemplate
                .replace("${audio_path}", narration.toAbsolutePath().toString())
                .replace("${frame_width}", formatDecimal(MANIM_FRAME_UNITS * preset.width() / shortSide))
                .replace("${frame_height}", formatDecimal(MANIM_FRAME_UNITS * preset.height() / shortSide))
                .replace("${duration_seconds}", formatSeconds(durationSeconds));
    }

    List<String> buildCompositionCommand(
            Path background,
            Path overlay,
            Path narration,
            double durationSeconds,
            Path output) {
        String duration = formatSeconds(durationSeconds);
        String size = preset.size();
        int width = preset.width();
        int height = preset.height();
        String fadeOutStart = formatSeconds(Math.max(0.0, durationSeconds - FADE_OUT_SECONDS));
        String fadeOut = formatSeconds(FADE_OUT_SECONDS);
        String backgroundFadeIn = formatSeconds(BACKGROUND_FADE_IN_SECONDS);
        String overlayFadeIn = formatSeconds(OVERLAY_FADE_IN_SECONDS);
        String hold = formatDecimal(BACKGROUND_HOLD_OPACITY);
        String dimming = formatDecimal(1.0 - BACKGROUND_HOLD_OPACITY);

        String backgroundCurve = "255*if(lt(T," + backgroundFadeIn + "),1-" + dimming + "*T/" + backgroundFadeIn
                + ",if(gt(T," + fadeOutStart + ")," + hold + "*(1-(T-" + fadeOutStart + ")/" + fadeOut + "),"
                + hold + "))";
        String overlayCurve = "255*if(lt(T," + overlayFadeIn + "),T/" + overlayFadeIn
                + ",if(gt(T," + fadeOutStart + "),1-(T-" + fadeOutStart + ")/" + fadeOut + ",1))";

        String filterComplex = String.join(";",
                "color=c=black:s=1x1:r=" + fps + ":d=" + duration + "[bg_curve_src]",
                "[bg_curve_src]geq=lum='" + backgroundCurve + "':a=255[bg_curve]",
                "[bg_curve]scale=" + width + ":" + height + ":flags=neighbor[bg_mask]",
                // Built in RGB so the multiply mask is not range-converted from limited YUV.
                "color=c=black:s=1x1:r=" + fps + ":d=" + duration + ",format=gbrp[wave_curve_src]",
                "[wave_curve_src]geq=r='" + overlayCurve + "':g='" + overlayCurve + "':b='" + overlayCurve
                        + "'[wave_curve]",
                "[wave_curve]scale=" + width + ":" + height + ":flags=neighbor[wave_mask]",
                "[1:v]scale=" + width + ":" + height + ":force_original_aspect_ratio=decrease,"
                        + "pad=" + width + ":" + height + ":(ow-iw)/2:(oh-ih)/2,fps=" + fps
                        + ",setsar=1,format=rgba[bg_img]",
                "[bg_img][bg_mask]alphamerge[bg_faded]",
                "[2:v]scale=" + width + ":" + height + ",fps=" + fps + ",setsar=1,format=gbrp[wave_src]",
                "[wave_src][wave_mask]blend=all_mode=multiply[wave_faded]",
                "[0:v][bg_faded]overlay=shortest=1,format=gbrp[bg_comp]",
                "[bg_comp][wave_faded]blend=all_mode=lighten:shortest=1,format=yuv420p[outv]");

        return List.of(
                ffmpegBinary,
                "-y",
                "-f", "lavfi",
                "-i", "color=c=black:s=" + size + ":r=" + fps + ":d=" + duration,
                "-loop", "1",
                "-t", duration,
                "-i", background.toString(),
                "-i", overlay.toString(),
                "-i", narration.toString(),
                "-filter_complex", filterComplex,
                "-map", "[outv]",
                "-map", "3:a",
                "-c:v", "libx264",
                "-pix_fmt", "yuv420p",
                "-preset", "fast",
                "-crf", "23",
                "-c:a", "aac",
                "-b:a", "192k",
                "-t", duration,
                output.toString());
    }

    private String loadTemplate() {
        try (InputStream input = new ClassPathResource(OVERLAY_TEMPLATE).getInputStream()) {
            return StreamUtils.copyToString(input, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Missing overlay template " + OVERLAY_TEMPLATE, e);
        }
    }

    private String formatSeconds(double seconds) {
        return String.format(Locale.ROOT, "%.3f", seconds);
    }

    private String formatDecimal(double value) {
        return String.format(Locale.ROOT, "%.3f", value);
    }
}
