package io.github.hide212131.langchain4j.formagent.runtime.agent;

import java.util.Objects;

/**
 * One finished run as seen by an {@link ObservabilitySink}. Exactly one of {@code output} and {@code error} is
 * non-null.
 */
public record RunEvent(String runId, TaskDefinition definition, TaskInput input, TaskOutput output, Throwable error,
        long durationMs, String resourceId) {

    public RunEvent {
        Objects.requireNonNull(definition, "definition");
        Objects.requireNonNull(input, "input");
        if ((output == null) == (error == null)) {
            throw new IllegalArgumentException("output と error はどちらか一方のみ指定してください");
        }
    }

    public static RunEvent success(String runId, TaskDefinition definition, TaskInput input, TaskOutput output,
            long durationMs, String resourceId) {
        return new RunEvent(runId, definition, input, Objects.requireNonNull(output, "output"), null, durationMs,
                resourceId);
    }

    public static RunEvent failure(String runId, TaskDefinition definition, TaskInput input, Throwable error,
            long durationMs, String resourceId) {
        return new RunEvent(runId, definition, input, null, Objects.requireNonNull(error, "error"), durationMs,
                resourceId);
    }

    public boolean succeeded() {
        return error == null;
    }
}
