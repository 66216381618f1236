package github.sarthakdev143.segment_forge.integration.media;

import github.sarthakdev143.segment_forge.exception.MediaToolException;
import github.sarthakdev143.segment_forge.exception.StageTimeoutException;

import java.util.List;

/**
 * Runs ffmpeg/ffprobe style subprocesses. The first element of {@code command} is the binary.
 */
public interface MediaCommandRunner {

    /**
     * Runs the command and returns its exit code and combined stdout/stderr, whatever the exit code.
     */
    MediaCommandResult execute(List<String> command, String stage)
            throws MediaToolException, StageTimeoutException, InterruptedException;

    /**
     * Runs the command and fails with the captured diagnostic output on a nonzero exit code.
     */
    default MediaCommandResult run(List<String> command, String stage)
            throws MediaToolException, StageTimeoutException, InterruptedException {
        MediaCommandResult result = execute(command, stage);
        if (!result.isSuccess()) {
            throw new MediaToolException(stage, result.exitCode(), result.output());
        }
        return result;
    }
}
