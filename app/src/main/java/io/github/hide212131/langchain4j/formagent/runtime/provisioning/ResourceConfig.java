package io.github.hide212131.langchain4j.formagent.runtime.provisioning;

import java.util.Map;

/**
 * Sizing of an ephemeral resource. Every value is optional; {@code null} leaves the provisioner default.
 */
public record ResourceConfig(Integer cpu, Integer memoryGb, Integer diskGb, Integer autoStopMinutes,
        Boolean ephemeral) {

    public static ResourceConfig defaults() {
        return new ResourceConfig(null, null, null, null, null);
    }

    /**
     * Interprets the opaque configuration carried by a task definition: a {@link ResourceConfig}, a map with the
     * same keys, or {@code null}.
     */
    public static ResourceConfig from(Object raw) {
        if (raw == null) {
            return defaults();
        }
        if (raw instanceof ResourceConfig config) {
            return config;
        }
        if (raw instanceof Map<?, ?> map) {
            return new ResourceConfig(integer(map, "cpu"), integer(map, "memoryGb"), integer(map, "diskGb"),
                    integer(map, "autoStopMinutes"), map.get("ephemeral") instanceof Boolean b ? b : null);
        }
        throw new IllegalArgumentException("未対応のリソース設定です: " + raw.getClass().getName());
    }

    private static Integer integer(Map<?, ?> map, String key) {
        Object value = map.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            return number.intValue();
        }
        throw new IllegalArgumentException("リソース設定 " + key + " は整数で指定してください: " + value);
    }
}
