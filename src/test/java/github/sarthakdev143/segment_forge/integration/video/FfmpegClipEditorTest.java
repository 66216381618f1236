package github.sarthakdev143.segment_forge.integration.video;

import github.sarthakdev143.segment_forge.config.SegmentForgeProperties;
import github.sarthakdev143.segment_forge.exception.MediaToolException;
import github.sarthakdev143.segment_forge.integration.media.MediaCommandResult;
import github.sarthakdev143.segment_forge.integration.media.MediaProbe;
import github.sarthakdev143.segment_forge.integration.media.MediaWorkspace;
import github.sarthakdev143.segment_forge.integration.media.RecordingMediaCommandRunner;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FfmpegClipEditorTest {

    @Mock
    private MediaProbe mediaProbe;

    @TempDir
    Path tempDir;

    private RecordingMediaCommandRunner commandRunner;
    private FfmpegClipEditor clipEditor;

    @BeforeEach
    void setUp() {
        commandRunner = new RecordingMediaCommandRunner();
        clipEditor = new FfmpegClipEditor(
                commandRunner,
                mediaProbe,
                new MediaWorkspace(tempDir),
                SegmentForgeProperties.defaults());
    }

    @Test
    void mergeWithCrossfadeAccumulatesOffsets() throws Exception {
        when(mediaProbe.durationSeconds(any(Path.class))).thenReturn(6.0);

        Path merged = clipEditor.mergeWithCrossfade(List.of(Path.of("a.mp4"), Path.of("b.mp4"), Path.of("c.mp4")));

        assertThat(commandRunner.stages()).containsExactly("crossfade clip 1", "crossfade clip 2");
        String firstFilter = valueAfter(commandRunner.commands().get(0), "-filter_complex");
        String secondFilter = valueAfter(commandRunner.commands().get(1), "-filter_complex");
        assertThat(firstFilter).contains("xfade=transition=fade:duration=0.500:offset=5.500");
        assertThat(firstFilter).contains("acrossfade=d=0.500");
        assertThat(secondFilter).contains("offset=11.000");
        assertThat(commandRunner.commands().get(1)).containsSequence("-i", lastArgument(commandRunner.commands().get(0)));
        assertThat(merged.toString()).isEqualTo(lastArgument(commandRunner.lastCommand()));
    }

    @Test
    void mergeWithCrossfadeFallsBackToVideoOnlyWhenAudioFails() throws Exception {
        when(mediaProbe.durationSeconds(any(Path.class))).thenReturn(5.0);
        commandRunner.respond("crossfade clip 1", new MediaCommandResult(1, "Stream specifier ':a' matches no streams"));

        clipEditor.mergeWithCrossfade(List.of(Path.of("a.mp4"), Path.of("b.mp4")));

        assertThat(commandRunner.stages()).containsExactly("crossfade clip 1", "crossfade clip 1 video only");
        List<String> fallback = commandRunner.lastCommand();
        assertThat(valueAfter(fallback, "-filter_complex")).doesNotContain("acrossfade");
        assertThat(fallback).contains("-an");
        assertThat(fallback).doesNotContain("[a]");
    }

    @Test
    void mergeWithCrossfadeReturnsSingleClipUntouched() throws Exception {
        when(mediaProbe.durationSeconds(any(Path.class))).thenReturn(5.0);

        Path merged = clipEditor.mergeWithCrossfade(List.of(Path.of("only.mp4")));

        assertThat(merged).isEqualTo(Path.of("only.mp4"));
        assertThat(commandRunner.commands()).isEmpty();
    }

    @Test
    void combineFreezesLastFrameWhenNarrationIsLonger() throws Exception {
        Path video = Path.of("visual.mp4");
        Path audio = Path.of("narration.wav");
        when(mediaProbe.durationSeconds(video)).thenReturn(5.0);
        when(mediaProbe.durationSeconds(audio)).thenReturn(7.0);

        clipEditor.combine(video, audio);

        List<String> command = commandRunner.lastCommand();
        assertThat(valueAfter(command, "-filter_complex")).isEqualTo("[0:v]tpad=stop_mode=clone:stop_duration=2.000[v]");
        assertThat(command).containsSequence("-map", "1:a");
        assertThat(command).doesNotContain("-shortest");
    }

    @Test
    void combineMuxesWhenDurationsAreClose() throws Exception {
        Path video = Path.of("visual.mp4");
        Path audio = Path.of("narration.wav");
        when(mediaProbe.durationSeconds(video)).thenReturn(5.0);
        when(mediaProbe.durationSeconds(audio)).thenReturn(5.3);

        Path combined = clipEditor.combine(video, audio);

        List<String> command = commandRunner.lastCommand();
        assertThat(command).contains("-shortest");
        assertThat(command).containsSequence("-c:a", "aac", "-b:a", "192k");
        assertThat(command).doesNotContain("-filter_complex");
        assertThat(combined.getParent()).isEqualTo(tempDir.resolve(MediaWorkspace.COMBINED));
    }

    @Test
    void extractLastFrameSeeksJustBeforeTheEnd() throws Exception {
        when(mediaProbe.durationSeconds(any(Path.class))).thenReturn(4.0);
        commandRunner.writeOutputFor("extract last frame");

        clipEditor.extractLastFrame(Path.of("previous.mp4"));

        assertThat(commandRunner.stages()).containsExactly("extract last frame");
        assertThat(commandRunner.lastCommand()).containsSequence("-ss", "3.900");
        assertThat(commandRunner.lastCommand()).containsSequence("-frames:v", "1");
    }

    @Test
    void extractLastFrameFallsBackToFirstFrameWhenSeekYieldsNothing() throws Exception {
        when(mediaProbe.durationSeconds(any(Path.class))).thenReturn(4.0);
        commandRunner.writeOutputFor("extract first frame");

        Path frame = clipEditor.extractLastFrame(Path.of("previous.mp4"));

        assertThat(commandRunner.stages()).containsExactly("extract last frame", "extract first frame");
        assertThat(commandRunner.lastCommand()).doesNotContain("-ss");
        assertThat(frame).isNotEmptyFile();
    }

    @Test
    void extractLastFrameFailsWhenNoFrameCanBeRead() throws Exception {
        when(mediaProbe.durationSeconds(any(Path.class))).thenReturn(0.1);

        assertThatThrownBy(() -> clipEditor.extractLastFrame(Path.of("tiny.mp4")))
                .isInstanceOf(MediaToolException.class)
                .hasMessageContaining("no frame could be extracted");
        assertThat(commandRunner.commands()).allSatisfy(command -> assertThat(command).doesNotContain("-ss"));
    }

    @Test
    void blackFrameUsesOutputPresetSize() throws Exception {
        clipEditor.blackFrame();

        assertThat(commandRunner.lastCommand()).containsSequence("-i", "color=c=black:s=1920x1080");
    }

    private String valueAfter(List<String> values, String flag) {
        int index = values.indexOf(flag);
        return values.get(index + 1);
    }

    private String lastArgument(List<String> command) {
        return command.get(command.size() - 1);
    }
}
