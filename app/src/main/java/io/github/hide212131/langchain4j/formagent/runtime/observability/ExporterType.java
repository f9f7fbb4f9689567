package io.github.hide212131.langchain4j.formagent.runtime.observability;

import java.util.Locale;

/** 実行記録の送信先。 */
public enum ExporterType {
    NONE, OTLP, LOG;

    public static ExporterType parse(String value) {
        if (value == null || value.isBlank()) {
            return NONE;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
        case "otlp" -> OTLP;
        case "log" -> LOG;
        case "none" -> NONE;
        default -> throw new IllegalArgumentException("exporter は none|otlp|log を指定してください: " + value);
        };
    }
}
