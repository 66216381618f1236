package github.sarthakdev143.segment_forge.integration.media;

import github.sarthakdev143.segment_forge.config.SegmentForgeProperties;
import github.sarthakdev143.segment_forge.exception.MediaToolException;
import github.sarthakdev143.segment_forge.exception.StageTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

@Component
public class ProcessMediaCommandRunner implements MediaCommandRunner {

    private static final Logger logger = LoggerFactory.getLogger(ProcessMediaCommandRunner.class);

    private final Duration timeout;

    public ProcessMediaCommandRunner(SegmentForgeProperties properties) {
        this.timeout = properties.media().commandTimeout();
    }

    @Override
    public MediaCommandResult execute(List<String> command, String stage)
            throws MediaToolException, StageTimeoutException, InterruptedException {
        logger.info("Running media command for stage {}: {}", stage, String.join(" ", command));
        Path outputLog = null;
        Process process = null;
        try {
            // Output goes to a file so a process that never closes its streams still hits the timeout.
            outputLog = Files.createTempFile("segment-forge-media-", ".log");
            process = new ProcessBuilder(command)
                    .redirectErrorStream(true)
                    .redirectOutput(outputLog.toFile())
                    .start();

            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                throw new StageTimeoutException(stage, timeout);
            }

            String output = Files.readString(outputLog, StandardCharsets.UTF_8);
            int exitCode = process.exitValue();
            if (exitCode != 0) {
                logger.warn("Media command for stage {} exited with code {}", stage, exitCode);
            }
            return new MediaCommandResult(exitCode, output);
        } catch (IOException e) {
            throw new MediaToolException(stage, e.getMessage(), e);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            throw e;
        } finally {
            deleteIfExists(outputLog);
        }
    }

    private void deleteIfExists(Path path) {
        if (path == null) {
            return;
        }
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            // Cleanup failures are non-fatal.
            logger.debug("Could not delete media command log {}", path, e);
        }
    }
}
