package io.github.hide212131.langchain4j.formagent.runtime.agent;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Result of a single run.
 *
 * <p>{@code metadata} carries at least {@link #DURATION_MS} once the runner has handed the output back, and
 * {@link #RESOURCE_ID} when a resource was provisioned. Backends may add {@link #TOKENS} or anything else.</p>
 */
public record TaskOutput(String text, Object rawBackendResponse, Map<String, Object> metadata) {

    public static final String DURATION_MS = "durationMs";
    public static final String RESOURCE_ID = "resourceId";
    public static final String TOKENS = "tokens";

    public TaskOutput {
        Objects.requireNonNull(text, "text は必須です");
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static TaskOutput of(String text) {
        return new TaskOutput(text, null, Map.of());
    }

    /** Merges {@code additions} over the existing metadata. Entries with a {@code null} value are skipped. */
    public TaskOutput withMetadata(Map<String, Object> additions) {
        Map<String, Object> merged = new LinkedHashMap<>(metadata);
        additions.forEach((key, value) -> {
            if (value != null) {
                merged.put(key, value);
            }
        });
        return new TaskOutput(text, rawBackendResponse, merged);
    }

    public Long durationMs() {
        Object value = metadata.get(DURATION_MS);
        return value instanceof Number number ? number.longValue() : null;
    }

    public String resourceId() {
        Object value = metadata.get(RESOURCE_ID);
        return value == null ? null : value.toString();
    }
}
