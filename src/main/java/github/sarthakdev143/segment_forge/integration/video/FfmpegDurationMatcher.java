package github.sarthakdev143.segment_forge.integration.video;

import github.sarthakdev143.segment_forge.config.SegmentForgeProperties;
import github.sarthakdev143.segment_forge.exception.MediaToolException;
import github.sarthakdev143.segment_forge.exception.SegmentFailureException;
import github.sarthakdev143.segment_forge.integration.media.MediaCommandRunner;
import github.sarthakdev143.segment_forge.integration.media.MediaProbe;
import github.sarthakdev143.segment_forge.integration.media.MediaWorkspace;
import github.sarthakdev143.segment_forge.service.DurationMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Retimes a clip with {@code setpts} on video and a chain of {@code atempo} stages on audio.
 */
@Component
public class FfmpegDurationMatcher implements DurationMatcher {

    private static final Logger logger = LoggerFactory.getLogger(FfmpegDurationMatcher.class);
    private static final double NO_OP_THRESHOLD_SECONDS = 0.1;
    private static final double MAX_TEMPO = 2.0;
    private static final double MIN_TEMPO = 0.5;
    private static final double EPSILON = 1e-9;

    private final MediaCommandRunner commandRunner;
    private final MediaProbe mediaProbe;
    private final MediaWorkspace workspace;
    private final String ffmpegBinary;

    public FfmpegDurationMatcher(
            MediaCommandRunner commandRunner,
            MediaProbe mediaProbe,
            MediaWorkspace workspace,
            SegmentForgeProperties properties) {
        this.commandRunner = commandRunner;
        this.mediaProbe = mediaProbe;
        this.workspace = workspace;
        this.ffmpegBinary = properties.media().ffmpegBinary();
    }

    @Override
    public Path match(Path source, double targetSeconds) throws SegmentFailureException, InterruptedException {
        if (targetSeconds <= 0.0) {
            throw new IllegalArgumentException("targetSeconds must be greater than 0.");
        }

        double sourceSeconds = mediaProbe.durationSeconds(source);
        Path output = workspace.newFile(MediaWorkspace.CLIPS, "matched", ".mp4");

        if (Math.abs(sourceSeconds - targetSeconds) < NO_OP_THRESHOLD_SECONDS) {
            logger.info("Clip {} already matches {}s, copying unchanged", source, formatSeconds(targetSeconds));
            try {
                Files.copy(source, output, StandardCopyOption.REPLACE_EXISTING);
            } catch (IOException e) {
                throw new MediaToolException("match duration", e.getMessage(), e);
            }
            return output;
        }

        double speedFactor = sourceSeconds / targetSeconds;
        boolean hasAudio = mediaProbe.hasAudioStream(source);
        logger.info(
                "Retiming {} from {}s to {}s speedFactor={} hasAudio={}",
                source,
                formatSeconds(sourceSeconds),
                formatSeconds(targetSeconds),
                formatSeconds(speedFactor),
                hasAudio);

        commandRunner.run(buildMatchCommand(source, output, speedFactor, hasAudio), "match duration");
        return output;
    }

    List<String> buildMatchCommand(Path source, Path output, double speedFactor, boolean hasAudio) {
        List<String> command = new ArrayList<>();
        command.add(ffmpegBinary);
        command.add("-y");
        command.add("-i");
        command.add(source.toString());
        command.add("-filter:v");
        command.add("setpts=" + String.format(Locale.ROOT, "%.6f", 1.0 / speedFactor) + "*PTS");

        if (hasAudio) {
            List<Double> stages = tempoStages(speedFactor);
            if (!stages.isEmpty()) {
                command.add("-filter:a");
                command.add(buildTempoFilter(stages));
            }
        } else {
            command.add("-an");
        }

        command.add("-c:v");
        command.add("libx264");
        command.add("-pix_fmt");
        command.add("yuv420p");
        command.add("-preset");
        command.add("fast");
        command.add("-crf");
        command.add("23");
        if (hasAudio) {
            command.add("-c:a");
            command.add("aac");
        }
        command.add(output.toString());
        return command;
    }

    /**
     * Splits a speed factor into {@code atempo} stages that each stay within [0.5, 2.0].
     */
    static List<Double> tempoStages(double speedFactor) {
        if (speedFactor <= 0.0) {
            throw new IllegalArgumentException("speedFactor must be greater than 0.");
        }

        List<Double> stages = new ArrayList<>();
        double remaining = speedFactor;
        while (remaining > MAX_TEMPO + EPSILON) {
            stages.add(MAX_TEMPO);
            remaining /= MAX_TEMPO;
        }
        while (remaining < MIN_TEMPO - EPSILON) {
            stages.add(MIN_TEMPO);
            remaining /= MIN_TEMPO;
        }
        if (Math.abs(remaining - 1.0) > EPSILON) {
            stages.add(remaining);
        }
        return stages;
    }

    private String buildTempoFilter(List<Double> stages) {
        List<String> filters = new ArrayList<>();
        for (double stage : stages) {
            filters.add("atempo=" + String.format(Locale.ROOT, "%.4f", stage));
        }
        return String.join(",", filters);
    }

    private String formatSeconds(double seconds) {
        return String.format(Locale.ROOT, "%.3f", seconds);
    }
}
