package github.sarthakdev143.segment_forge.model;

/**
 * How many equal clips cover a target duration when a backend can only emit clips between
 * {@code minClipSeconds} and {@code maxClipSeconds} long.
 */
public record ClipPlan(int clipCount, double clipSeconds) {

    public static ClipPlan forTarget(double targetSeconds, double minClipSeconds, double maxClipSeconds) {
        if (targetSeconds <= 0.0) {
            throw new IllegalArgumentException("targetSeconds must be greater than 0.");
        }
        if (minClipSeconds <= 0.0 || maxClipSeconds < minClipSeconds) {
            throw new IllegalArgumentException("clip bounds must satisfy 0 < min <= max.");
        }

        int clipCount = Math.max(1, (int) Math.ceil(targetSeconds / maxClipSeconds));
        double clipSeconds = Math.max(minClipSeconds, Math.min(maxClipSeconds, targetSeconds / clipCount));
        return new ClipPlan(clipCount, clipSeconds);
    }
}
