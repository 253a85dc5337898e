package dev.tana.edge.api;

import java.util.List;

/**
 * Outcome of a one-shot script run.
 */
public record ScriptResult(boolean success, String error, List<String> logs) {
    public ScriptResult {
        logs = List.copyOf(logs == null ? List.of() : logs);
    }

    public static ScriptResult success(List<String> logs) {
        return new ScriptResult(true, null, logs);
    }

    public static ScriptResult failure(String error, List<String> logs) {
        return new ScriptResult(false, error, logs);
    }

    public int exitCode() {
        return success ? 0 : 1;
    }
}
