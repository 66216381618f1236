package github.sarthakdev143.segment_forge.model.render;

import java.nio.file.Path;

/**
 * Result of a render call. A backend may author a script and then fail to execute it; that case
 * is a {@link ScriptOnly} outcome rather than an exception so the script survives for inspection.
 */
public sealed interface RenderOutcome {

    record Rendered(Path videoPath, String scriptUsed) implements RenderOutcome {
    }

    record ScriptOnly(String script, String error) implements RenderOutcome {
    }
}
