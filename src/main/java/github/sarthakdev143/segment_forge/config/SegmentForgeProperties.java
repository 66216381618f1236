package github.sarthakdev143.segment_forge.config;

import github.sarthakdev143.segment_forge.model.OutputPreset;
import github.sarthakdev143.segment_forge.model.VoiceoverConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Settings bound from {@code segment-forge.*}. Every group falls back to working defaults so the
 * application starts with an empty configuration.
 */
@ConfigurationProperties(prefix = "segment-forge")
public record SegmentForgeProperties(
        Storage storage,
        Media media,
        Output output,
        Renderers renderers,
        Speech speech,
        Pipeline pipeline,
        Execution execution) {

    public SegmentForgeProperties {
        storage = storage == null ? new Storage(null) : storage;
        media = media == null ? new Media(null, null, null) : media;
        output = output == null ? new Output(null, 0, 0) : output;
        renderers = renderers == null ? new Renderers(null, null, null, null, null, null) : renderers;
        speech = speech == null ? new Speech(null, null, null, 0.0) : speech;
        pipeline = pipeline == null ? new Pipeline(0.0, 0.0, 0.0, 0.0, 0.0) : pipeline;
        execution = execution == null ? new Execution(0) : execution;
    }

    public static SegmentForgeProperties defaults() {
        return new SegmentForgeProperties(null, null, null, null, null, null, null);
    }

    public record Storage(Path outputDir) {

        public Storage {
            outputDir = outputDir == null ? Path.of("videos") : outputDir;
        }
    }

    public record Media(String ffmpegBinary, String ffprobeBinary, Duration commandTimeout) {

        public Media {
            ffmpegBinary = firstNonBlank(ffmpegBinary, System.getenv("FFMPEG_PATH"), "ffmpeg");
            ffprobeBinary = firstNonBlank(ffprobeBinary, System.getenv("FFPROBE_PATH"), "ffprobe");
            commandTimeout = commandTimeout == null ? Duration.ofMinutes(10) : commandTimeout;
        }
    }

    public record Output(OutputPreset preset, int fps, int audioSampleRate) {

        public Output {
            preset = preset == null ? OutputPreset.LANDSCAPE_16_9 : preset;
            fps = fps <= 0 ? 30 : fps;
            audioSampleRate = audioSampleRate <= 0 ? 44100 : audioSampleRate;
        }
    }

    public record Renderers(
            String animationUrl,
            String manimUrl,
            String pysimUrl,
            Duration connectTimeout,
            Duration previewTimeout,
            Duration renderTimeout) {

        public Renderers {
            animationUrl = firstNonBlank(animationUrl, null, "http://localhost:8001");
            manimUrl = firstNonBlank(manimUrl, null, "http://localhost:8002");
            pysimUrl = firstNonBlank(pysimUrl, null, "http://localhost:8003");
            connectTimeout = connectTimeout == null ? Duration.ofSeconds(30) : connectTimeout;
            previewTimeout = previewTimeout == null ? Duration.ofMinutes(2) : previewTimeout;
            renderTimeout = renderTimeout == null ? Duration.ofMinutes(10) : renderTimeout;
        }
    }

    public record Speech(String url, Duration timeout, String defaultVoice, double defaultSpeed) {

        public Speech {
            url = firstNonBlank(url, null, "http://localhost:8004");
            timeout = timeout == null ? Duration.ofMinutes(2) : timeout;
            defaultVoice = firstNonBlank(defaultVoice, null, VoiceoverConfig.DEFAULT_VOICE);
            defaultSpeed = defaultSpeed <= 0.0 ? VoiceoverConfig.DEFAULT_SPEED : defaultSpeed;
        }
    }

    public record Pipeline(
            double defaultSegmentSeconds,
            double durationToleranceSeconds,
            double crossfadeSeconds,
            double minClipSeconds,
            double maxClipSeconds) {

        public Pipeline {
            defaultSegmentSeconds = defaultSegmentSeconds <= 0.0 ? 5.0 : defaultSegmentSeconds;
            durationToleranceSeconds = durationToleranceSeconds <= 0.0 ? 0.5 : durationToleranceSeconds;
            crossfadeSeconds = crossfadeSeconds <= 0.0 ? 0.5 : crossfadeSeconds;
            minClipSeconds = minClipSeconds <= 0.0 ? 4.0 : minClipSeconds;
            maxClipSeconds = maxClipSeconds <= 0.0 ? 8.0 : maxClipSeconds;
        }
    }

    /**
     * Segment loops and retries each hold one thread for as long as they run. Work beyond
     * {@code maxConcurrentTasks} is rejected rather than queued behind running jobs.
     */
    public record Execution(int maxConcurrentTasks) {

        public Execution {
            maxConcurrentTasks = maxConcurrentTasks <= 0 ? 32 : maxConcurrentTasks;
        }
    }

    private static String firstNonBlank(String configured, String fallback, String defaultValue) {
        if (configured != null && !configured.isBlank()) {
            return configured.trim();
        }
        if (fallback != null && !fallback.isBlank()) {
            return fallback.trim();
        }
        return defaultValue;
    }
}
