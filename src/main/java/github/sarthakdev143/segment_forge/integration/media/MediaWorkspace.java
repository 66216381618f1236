package github.sarthakdev143.segment_forge.integration.media;

import github.sarthakdev143.segment_forge.config.SegmentForgeProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.UUID;

/**
 * Allocates output files under the configured output directory.
 */
@Component
public class MediaWorkspace {

    public static final String CLIPS = "clips";
    public static final String COMBINED = "combined";
    public static final String FRAMES = "frames";
    public static final String TRANSITIONS = "transitions";
    public static final String FINAL = "final";

    private final Path root;

    @Autowired
    public MediaWorkspace(SegmentForgeProperties properties) {
        this.root = properties.storage().outputDir();
    }

    public MediaWorkspace(Path root) {
        this.root = root;
    }

    public Path newFile(String area, String prefix, String extension) {
        Path directory = root.resolve(area);
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create output directory " + directory, e);
        }
        return directory.resolve(prefix + "_" + UUID.randomUUID().toString().replace("-", "") + extension);
    }
}
