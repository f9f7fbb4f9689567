package io.github.hide212131.langchain4j.formagent.runtime.agent;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** エージェント実行への入力。context は実行ごとに派生コピーで拡張される。 */
public record TaskInput(String text, Map<String, Object> context) {

    public static final String RESOURCE_ID = "resourceId";

    public TaskInput {
        Objects.requireNonNull(text, "text は必須です");
        context = context == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(context));
    }

    public static TaskInput of(String text) {
        return new TaskInput(text, Map.of());
    }

    /** Returns a copy whose context additionally carries {@code key=value}; this instance is left untouched. */
    public TaskInput withContextEntry(String key, Object value) {
        Objects.requireNonNull(key, "key");
        Map<String, Object> enriched = new LinkedHashMap<>(context);
        enriched.put(key, value);
        return new TaskInput(text, enriched);
    }

    public String resourceId() {
        Object value = context.get(RESOURCE_ID);
        return value == null ? null : value.toString();
    }
}
