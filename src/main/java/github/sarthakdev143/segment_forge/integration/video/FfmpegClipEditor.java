package github.sarthakdev143.segment_forge.integration.video;

import github.sarthakdev143.segment_forge.config.SegmentForgeProperties;
import github.sarthakdev143.segment_forge.exception.MediaToolException;
import github.sarthakdev143.segment_forge.exception.SegmentFailureException;
import github.sarthakdev143.segment_forge.integration.media.MediaCommandResult;
import github.sarthakdev143.segment_forge.integration.media.MediaCommandRunner;
import github.sarthakdev143.segment_forge.integration.media.MediaProbe;
import github.sarthakdev143.segment_forge.integration.media.MediaWorkspace;
import github.sarthakdev143.segment_forge.model.OutputPreset;
import github.sarthakdev143.segment_forge.service.ClipEditor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

@Component
public class FfmpegClipEditor implements ClipEditor {

    private static final Logger logger = LoggerFactory.getLogger(FfmpegClipEditor.class);
    private static final double FRAME_SEEK_BACK_SECONDS = 0.1;
    private static final double MIN_SEEKABLE_SECONDS = 0.2;

    private final MediaCommandRunner commandRunner;
    private final MediaProbe mediaProbe;
    private final MediaWorkspace workspace;
    private final String ffmpegBinary;
    private final OutputPreset preset;
    private final double crossfadeSeconds;
    private final double freezeThresholdSeconds;

    public FfmpegClipEditor(
            MediaCommandRunner commandRunner,
            MediaProbe mediaProbe,
            MediaWorkspace workspace,
            SegmentForgeProperties properties) {
        this.commandRunner = commandRunner;
        this.mediaProbe = mediaProbe;
        this.workspace = workspace;
        this.ffmpegBinary = properties.media().ffmpegBinary();
        this.preset = properties.output().preset();
        this.crossfadeSeconds = properties.pipeline().crossfadeSeconds();
        this.freezeThresholdSeconds = properties.pipeline().durationToleranceSeconds();
    }

    @Override
    public Path mergeWithCrossfade(List<Path> clips) throws SegmentFailureException, InterruptedException {
        if (clips == null || clips.isEmpty()) {
            throw new IllegalArgumentException("At least one clip is required to merge.");
        }

        Path merged = clips.get(0);
        double mergedSeconds = mediaProbe.durationSeconds(merged);

        for (int index = 1; index < clips.size(); index++) {
            Path next = clips.get(index);
            double offset = Math.max(mergedSeconds - crossfadeSeconds, 0.0);
            Path output = workspace.newFile(MediaWorkspace.CLIPS, "crossfade", ".mp4");
            String stage = "crossfade clip " + index;

            MediaCommandResult result = commandRunner.execute(
                    buildCrossfadeCommand(merged, next, offset, output, true),
                    stage);
            if (!result.isSuccess()) {
                logger.warn("Audio crossfade failed for {}, retrying video only", stage);
                commandRunner.run(buildCrossfadeCommand(merged, next, offset, output, false), stage + " video only");
            }

            mergedSeconds = mergedSeconds + mediaProbe.durationSeconds(next) - crossfadeSeconds;
            merged = output;
        }
        return merged;
    }

    @Override
    public Path combine(Path video, Path audio) throws SegmentFailureException, InterruptedException {
        double videoSeconds = mediaProbe.durationSeconds(video);
        double audioSeconds = mediaProbe.durationSeconds(audio);
        Path output = workspace.newFile(MediaWorkspace.COMBINED, "combined", ".mp4");

        List<String> command;
        if (audioSeconds > videoSeconds + freezeThresholdSeconds) {
            double freezeSeconds = audioSeconds - videoSeconds;
            logger.info("Narration outlasts visual by {}s, freezing last frame", formatSeconds(freezeSeconds));
            command = buildFreezeFrameMuxCommand(video, audio, freezeSeconds, output);
        } else {
            command = buildMuxCommand(video, audio, output);
        }

        commandRunner.run(command, "combine audio and video");
        return output;
    }

    @Override
    public Path extractLastFrame(Path video) throws SegmentFailureException, InterruptedException {
        double durationSeconds = mediaProbe.durationSeconds(video);
        double seekSeconds = durationSeconds < MIN_SEEKABLE_SECONDS
                ? 0.0
                : Math.max(0.0, durationSeconds - FRAME_SEEK_BACK_SECONDS);
        Path output = workspace.newFile(MediaWorkspace.FRAMES, "last_frame", ".png");

        commandRunner.run(buildFrameCommand(video, seekSeconds, output), "extract last frame");
        if (!isNonEmptyFile(output)) {
            logger.warn("No frame at {}s of {}, extracting the first frame instead", formatSeconds(seekSeconds), video);
            commandRunner.run(buildFrameCommand(video, 0.0, output), "extract first frame");
            if (!isNonEmptyFile(output)) {
                throw new MediaToolException("extract last frame", "no frame could be extracted from " + video, null);
            }
        }
        return output;
    }

    @Override
    public Path blackFrame() throws SegmentFailureException, InterruptedException {
        Path output = workspace.newFile(MediaWorkspace.FRAMES, "black_frame", ".png");
        commandRunner.run(buildBlackFrameCommand(output), "black frame");
        return output;
    }

    List<String> buildCrossfadeCommand(Path first, Path second, double offset, Path output, boolean withAudio) {
        String videoFilter = "[0:v][1:v]xfade=transition=fade:duration=" + formatSeconds(crossfadeSeconds)
                + ":offset=" + formatSeconds(offset) + "[v]";

        List<String> command = new ArrayList<>();
        command.add(ffmpegBinary);
        command.add("-y");
        command.add("-i");
        command.add(first.toString());
        command.add("-i");
        command.add(second.toString());
        command.add("-filter_complex");
        command.add(withAudio
                ? videoFilter + ";[0:a][1:a]acrossfade=d=" + formatSeconds(crossfadeSeconds) + "[a]"
                : videoFilter);
        command.add("-map");
        command.add("[v]");
        if (withAudio) {
            command.add("-map");
            command.add("[a]");
        }
        addVideoEncoding(command);
        if (withAudio) {
            command.add("-c:a");
            command.add("aac");
        } else {
            command.add("-an");
        }
        command.add(output.toString());
        return command;
    }

    List<String> buildFreezeFrameMuxCommand(Path video, Path audio, double freezeSeconds, Path output) {
        List<String> command = new ArrayList<>();
        command.add(ffmpegBinary);
        command.add("-y");
        command.add("-i");
        command.add(video.toString());
        command.add("-i");
        command.add(audio.toString());
        command.add("-filter_complex");
        command.add("[0:v]tpad=stop_mode=clone:stop_duration=" + formatSeconds(freezeSeconds) + "[v]");
        command.add("-map");
        command.add("[v]");
        command.add("-map");
        command.add("1:a");
        addVideoEncoding(command);
        addAudioEncoding(command);
        command.add(output.toString());
        return command;
    }

    List<String> buildMuxCommand(Path video, Path audio, Path output) {
        List<String> command = new ArrayList<>();
        command.add(ffmpegBinary);
        command.add("-y");
        command.add("-i");
        command.add(video.toString());
        command.add("-i");
        command.add(audio.toString());
        command.add("-map");
        command.add("0:v:0");
        command.add("-map");
        command.add("1:a:0");
        addVideoEncoding(command);
        addAudioEncoding(command);
        command.add("-shortest");
        command.add(output.toString());
        return command;
    }

    List<String> buildFrameCommand(Path video, double seekSeconds, Path output) {
        List<String> command = new ArrayList<>();
        command.add(ffmpegBinary);
        command.add("-y");
        if (seekSeconds > 0.0) {
            command.add("-ss");
            command.add(formatSeconds(seekSeconds));
        }
        command.add("-i");
        command.add(video.toString());
        command.add("-frames:v");
        command.add("1");
        command.add(output.toString());
        return command;
    }

    List<String> buildBlackFrameCommand(Path output) {
        return List.of(
                ffmpegBinary,
                "-y",
                "-f", "lavfi",
                "-i", "color=c=black:s=" + preset.size(),
                "-frames:v", "1",
                output.toString());
    }

    private void addVideoEncoding(List<String> command) {
        command.add("-c:v");
        command.add("libx264");
        command.add("-pix_fmt");
        command.add("yuv420p");
        command.add("-preset");
        command.add("fast");
        command.add("-crf");
        command.add("23");
    }

    private void addAudioEncoding(List<String> command) {
        command.add("-c:a");
        command.add("aac");
        command.add("-b:a");
        command.add("192k");
    }

    private boolean isNonEmptyFile(Path path) {
        try {
            return Files.isRegularFile(path) && Files.size(path) > 0;
        } catch (IOException e) {
            return false;
        }
    }

    private String formatSeconds(double seconds) {
        return String.format(Locale.ROOT, "%.3f", seconds);
    }
}
