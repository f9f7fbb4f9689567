package io.github.hide212131.langchain4j.formagent.runtime.config;

import java.util.Locale;

/** リソースプロビジョナの種別。 */
public enum ProvisionerType {
    NONE, LOCAL, DOCKER;

    public static ProvisionerType parse(String value) {
        if (value == null || value.isBlank()) {
            return LOCAL;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
        case "none" -> NONE;
        case "local" -> LOCAL;
        case "docker" -> DOCKER;
        default -> throw new IllegalArgumentException("不明なプロビジョナです: " + value);
        };
    }
}
