package github.sarthakdev143.segment_forge.config;

import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.TimeUnit;

@Component
@ConditionalOnProperty(name = "segment-forge.preflight.enabled", havingValue = "true", matchIfMissing = true)
public class StartupPreflightChecks implements ApplicationRunner {

    private static final int TOOL_CHECK_TIMEOUT_SECONDS = 10;

    private final SegmentForgeProperties properties;

    public StartupPreflightChecks(SegmentForgeProperties properties) {
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        checkTool(properties.media().ffmpegBinary(), "FFmpeg", "FFMPEG_PATH");
        checkTool(properties.media().ffprobeBinary(), "FFprobe", "FFPROBE_PATH");
        checkOutputDirectory(properties.storage().outputDir());
    }

    private void checkTool(String binary, String toolName, String envName) {
        if (binary.contains("/") || binary.contains("\\")) {
            Path toolPath = Path.of(binary);
            if (!Files.isRegularFile(toolPath)) {
                throw new IllegalStateException(
                        toolName + " binary not found at " + toolPath.toAbsolutePath()
                                + ". Set " + envName + " to a valid executable path.");
            }
        }

        try {
            Process process = new ProcessBuilder(binary, "-version")
                    .redirectErrorStream(true)
                    .start();
            boolean finished = process.waitFor(TOOL_CHECK_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            if (!finished) {
                process.destroyForcibly();
            }
            if (!finished || process.exitValue() != 0) {
                throw new IllegalStateException(
                        toolName + " is not available. Install it or set " + envName + ".");
            }
        } catch (IOException | InterruptedException e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            throw new IllegalStateException(
                    toolName + " is not available. Install it or set " + envName + ".",
                    e);
        }
    }

    private void checkOutputDirectory(Path outputDir) {
        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new IllegalStateException(
                    "Output directory " + outputDir.toAbsolutePath()
                            + " cannot be created. Set segment-forge.storage.output-dir to a writable path.",
                    e);
        }

        if (!Files.isWritable(outputDir)) {
            throw new IllegalStateException(
                    "Output directory " + outputDir.toAbsolutePath() + " is not writable.");
        }
    }
}
