package github.sarthakdev143.segment_forge.integration.media;

public record MediaCommandResult(int exitCode, String output) {

    public boolean isSuccess() {
        return exitCode == 0;
    }
}
