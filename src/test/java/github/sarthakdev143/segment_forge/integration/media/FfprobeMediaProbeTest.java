package github.sarthakdev143.segment_forge.integration.media;

import github.sarthakdev143.segment_forge.config.SegmentForgeProperties;
import github.sarthakdev143.segment_forge.exception.MediaToolException;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FfprobeMediaProbeTest {

    private final RecordingMediaCommandRunner commandRunner = new RecordingMediaCommandRunner();
    private final FfprobeMediaProbe probe = new FfprobeMediaProbe(commandRunner, SegmentForgeProperties.defaults());

    @Test
    void durationSecondsParsesFirstOutputLine() throws Exception {
        commandRunner.respond("probe duration", new MediaCommandResult(0, "\n12.480000\n"));

        double duration = probe.durationSeconds(Path.of("clip.mp4"));

        assertThat(duration).isEqualTo(12.48);
        assertThat(commandRunner.lastCommand()).containsSequence("-show_entries", "format=duration");
        assertThat(commandRunner.lastCommand()).endsWith("clip.mp4");
    }

    @Test
    void durationSecondsRejectsUnreadableOutput() {
        commandRunner.respond("probe duration", new MediaCommandResult(0, "N/A"));

        assertThatThrownBy(() -> probe.durationSeconds(Path.of("broken.mp4")))
                .isInstanceOf(MediaToolException.class)
                .hasMessageContaining("unreadable duration 'N/A'");
    }

    @Test
    void durationSecondsFailsOnNonZeroExit() {
        commandRunner.respond("probe duration", new MediaCommandResult(1, "No such file"));

        assertThatThrownBy(() -> probe.durationSeconds(Path.of("missing.mp4")))
                .isInstanceOf(MediaToolException.class)
                .hasMessageContaining("No such file");
    }

    @Test
    void hasAudioStreamDetectsAudioCodecType() throws Exception {
        commandRunner.respond("probe audio stream", new MediaCommandResult(0, "audio\n"));

        assertThat(probe.hasAudioStream(Path.of("narrated.mp4"))).isTrue();
        assertThat(commandRunner.lastCommand()).containsSequence("-select_streams", "a");
    }

    @Test
    void hasAudioStreamIsFalseForSilentClip() throws Exception {
        commandRunner.respond("probe audio stream", new MediaCommandResult(0, ""));

        assertThat(probe.hasAudioStream(Path.of("silent.mp4"))).isFalse();
    }
}
