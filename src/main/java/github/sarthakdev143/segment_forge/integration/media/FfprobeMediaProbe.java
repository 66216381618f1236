package github.sarthakdev143.segment_forge.integration.media;

import github.sarthakdev143.segment_forge.config.SegmentForgeProperties;
import github.sarthakdev143.segment_forge.exception.MediaToolException;
import github.sarthakdev143.segment_forge.exception.SegmentFailureException;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;

@Component
public class FfprobeMediaProbe implements MediaProbe {

    private final MediaCommandRunner commandRunner;
    private final String ffprobeBinary;

    public FfprobeMediaProbe(MediaCommandRunner commandRunner, SegmentForgeProperties properties) {
        this.commandRunner = commandRunner;
        this.ffprobeBinary = properties.media().ffprobeBinary();
    }

    @Override
    public double durationSeconds(Path media) throws SegmentFailureException, InterruptedException {
        String stage = "probe duration";
        MediaCommandResult result = commandRunner.run(buildDurationCommand(media), stage);
        String value = firstLine(result.output());
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new MediaToolException(stage, "unreadable duration '" + value + "' for " + media, e);
        }
    }

    @Override
    public boolean hasAudioStream(Path media) throws SegmentFailureException, InterruptedException {
        MediaCommandResult result = commandRunner.run(buildAudioStreamCommand(media), "probe audio stream");
        return result.output().lines().anyMatch(line -> line.trim().startsWith("audio"));
    }

    List<String> buildDurationCommand(Path media) {
        return List.of(
                ffprobeBinary,
                "-v", "error",
                "-show_entries", "format=duration",
                "-of", "default=noprint_wrappers=1:nokey=1",
                media.toString());
    }

    List<String> buildAudioStreamCommand(Path media) {
        return List.of(
                ffprobeBinary,
                "-v", "error",
                "-select_streams", "a",
                "-show_entries", "stream=codec_type",
                "-of", "csv=p=0",
                media.toString());
    }

    private String firstLine(String output) {
        return output.lines()
                .map(String::trim)
                .filter(line -> !line.isEmpty())
                .findFirst()
                .orElse("");
    }
}
