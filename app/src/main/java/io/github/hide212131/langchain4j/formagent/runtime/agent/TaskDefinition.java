package io.github.hide212131.langchain4j.formagent.runtime.agent;

import java.util.Objects;

/**
 * Immutable description of one unit of work. {@code resourceConfig} is opaque to the runner and handed to the
 * provisioner untouched; it may be {@code null}.
 */
public record TaskDefinition(String instructions, boolean requiresResource, Object resourceConfig) {

    public TaskDefinition {
        Objects.requireNonNull(instructions, "instructions は必須です");
    }

    public static TaskDefinition withoutResource(String instructions) {
        return new TaskDefinition(instructions, false, null);
    }

    public static TaskDefinition withResource(String instructions, Object resourceConfig) {
        return new TaskDefinition(instructions, true, resourceConfig);
    }
}
