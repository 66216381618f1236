package github.sarthakdev143.segment_forge.integration.video;

import github.sarthakdev143.segment_forge.config.SegmentForgeProperties;
import github.sarthakdev143.segment_forge.exception.MediaToolException;
import github.sarthakdev143.segment_forge.exception.SegmentFailureException;
import github.sarthakdev143.segment_forge.integration.media.MediaCommandRunner;
import github.sarthakdev143.segment_forge.integration.media.MediaProbe;
import github.sarthakdev143.segment_forge.integration.media.MediaWorkspace;
import github.sarthakdev143.segment_forge.model.OutputPreset;
import github.sarthakdev143.segment_forge.service.FinalAssembler;
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
 * Normalizes every clip to the output preset, frame rate and sample rate, then concatenates them.
 * Clips without audio are paired with a generated silent track of their own length.
 */
@Component
public class FfmpegFinalAssembler implements FinalAssembler {

    private static final Logger logger = LoggerFactory.getLogger(FfmpegFinalAssembler.class);

    private final MediaCommandRunner commandRunner;
    private final MediaProbe mediaProbe;
    private final MediaWorkspace workspace;
    private final String ffmpegBinary;
    private final OutputPreset preset;
    private final int fps;
    private final int audioSampleRate;

    public FfmpegFinalAssembler(
            MediaCommandRunner commandRunner,
            MediaProbe mediaProbe,
            MediaWorkspace workspace,
            SegmentForgeProperties properties) {
        this.commandRunner = commandRunner;
        this.mediaProbe = mediaProbe;
        this.workspace = workspace;
        this.ffmpegBinary = properties.media().ffmpegBinary();
        this.preset = properties.output().preset();
        this.fps = properties.output().fps();
        this.audioSampleRate = properties.output().audioSampleRate();
    }

    @Override
    public Path assemble(String jobId, List<Path> clips) throws SegmentFailureException, InterruptedException {
        if (clips == null || clips.isEmpty()) {
            throw new IllegalArgumentException("At least one clip is required for final assembly.");
        }

        Path output = workspace.newFile(MediaWorkspace.FINAL, "final_" + jobId, ".mp4");
        if (clips.size() == 1) {
            try {
                Files.copy(clips.get(0), output, StandardCopyOption.REPLACE_EXISTING);
            } catch (IOException e) {
                throw new MediaToolException("final assembly", e.getMessage(), e);
            }
            return output;
        }

        List<ClipInput> inputs = new ArrayList<>();
        for (Path clip : clips) {
            boolean hasAudio = mediaProbe.hasAudioStream(clip);
            double durationSeconds = hasAudio ? 0.0 : mediaProbe.durationSeconds(clip);
            inputs.add(new ClipInput(clip, hasAudio, durationSeconds));
        }

        logger.info("Concatenating {} clips for job {} at {}@{}fps", inputs.size(), jobId, preset.size(), fps);
        commandRunner.run(buildConcatCommand(inputs, output), "final assembly");
        return output;
    }

    List<String> buildConcatCommand(List<ClipInput> clips, Path output) {
        List<String> command = new ArrayList<>();
        command.add(ffmpegBinary);
        command.add("-y");
        for (ClipInput clip : clips) {
            command.add("-i");
            command.add(clip.path().toString());
        }

        // Silent tracks are appended after the clips; remember which input index each one got.
        int[] audioInputIndex = new int[clips.size()];
        int nextInput = clips.size();
        for (int index = 0; index < clips.size(); index++) {
            ClipInput clip = clips.get(index);
            if (clip.hasAudio()) {
                audioInputIndex[index] = index;
                continue;
            }
            command.add("-f");
            command.add("lavfi");
            command.add("-t");
            command.add(formatSeconds(clip.durationSeconds()));
            command.add("-i");
            command.add("anullsrc=channel_layout=stereo:sample_rate=" + audioSampleRate);
            audioInputIndex[index] = nextInput++;
        }

        int width = preset.width();
        int height = preset.height();
        StringBuilder filterComplex = new StringBuilder();
        StringBuilder concatInputs = new StringBuilder();
        for (int index = 0; index < clips.size(); index++) {
            filterComplex.append("[").append(index).append(":v]")
                    .append("scale=").append(width).append(":").append(height)
                    .append(":force_original_aspect_ratio=decrease,")
                    .append("pad=").append(width).append(":").append(height).append(":(ow-iw)/2:(oh-ih)/2,")
                    .append("fps=").append(fps).append(",setsar=1")
                    .append("[v").append(index).append("];");
            filterComplex.append("[").append(audioInputIndex[index]).append(":a]")
                    .append("aresample=").append(audioSampleRate)
                    .append(",aformat=channel_layouts=stereo")
                    .append("[a").append(index).append("];");
            concatInputs.append("[v").append(index).append("][a").append(index).append("]");
        }
        filterComplex.append(concatInputs)
                .append("concat=n=").append(clips.size()).append(":v=1:a=1[outv][outa]");

        command.add("-filter_complex");
        command.add(filterComplex.toString());
        command.add("-map");
        command.add("[outv]");
        command.add("-map");
        command.add("[outa]");
        command.add("-c:v");
        command.add("libx264");
        command.add("-pix_fmt");
        command.add("yuv420p");
        command.add("-preset");
        command.add("fast");
        command.add("-crf");
        command.add("23");
        command.add("-c:a");
        command.add("aac");
        command.add("-b:a");
        command.add("192k");
        command.add(output.toString());
        return command;
    }

    private String formatSeconds(double seconds) {
        return String.format(Locale.ROOT, "%.3f", seconds);
    }

    record ClipInput(Path path, boolean hasAudio, double durationSeconds) {
    }
}
