package io.github.hide212131.langchain4j.formagent.runtime.observability;

import io.github.hide212131.langchain4j.formagent.runtime.config.ConfigurationException;
import io.github.hide212131.langchain4j.formagent.runtime.config.EnvironmentResolver;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/** 環境変数/CLI オプションから実行記録の設定を構築する。 */
public final class ObservabilityConfigurationLoader {

    static final String ENV_EXPORTER = "EXPORTER";
    static final String ENV_OTLP_ENDPOINT = "OTEL_EXPORTER_OTLP_ENDPOINT";
    static final String ENV_OTLP_HEADERS = "OTEL_EXPORTER_OTLP_HEADERS";
    static final String ENV_LANGFUSE_PUBLIC_KEY = "LANGFUSE_PUBLIC_KEY";
    static final String ENV_LANGFUSE_SECRET_KEY = "LANGFUSE_SECRET_KEY";

    private final EnvironmentResolver environment;

    public ObservabilityConfigurationLoader() {
        this(EnvironmentResolver.system());
    }

    public ObservabilityConfigurationLoader(EnvironmentResolver environment) {
        this.environment = Objects.requireNonNull(environment, "environment");
    }

    public ObservabilityConfiguration load(ExporterType cliExporter, String endpointOverride, String headersOverride) {
        ExporterType exporter;
        try {
            exporter = cliExporter == null ? ExporterType.parse(environment.get(ENV_EXPORTER)) : cliExporter;
        } catch (IllegalArgumentException ex) {
            throw new ConfigurationException(ex.getMessage(), ex);
        }
        String endpoint = firstNonBlank(endpointOverride, environment.get(ENV_OTLP_ENDPOINT));
        String headers = firstNonBlank(headersOverride, environment.get(ENV_OTLP_HEADERS));
        Map<String, String> effectiveHeaders = enrichHeadersForLangfuse(endpoint, parseHeaders(headers));
        return new ObservabilityConfiguration(exporter, endpoint, effectiveHeaders);
    }

    static Map<String, String> parseHeaders(String raw) {
        if (raw == null || raw.isBlank()) {
            return Map.of();
        }
        Map<String, String> headers = new HashMap<>();
        for (String pair : raw.split(",")) {
            String[] kv = pair.split("=", 2);
            if (kv.length == 2 && !kv[0].isBlank()) {
                headers.put(kv[0].trim(), kv[1].trim());
            }
        }
        return headers;
    }

    private Map<String, String> enrichHeadersForLangfuse(String endpoint, Map<String, String> headers) {
        if (endpoint == null || !endpoint.contains("/api/public/otel")) {
            return headers;
        }
        for (String key : headers.keySet()) {
            if ("authorization".equals(key.toLowerCase(Locale.ROOT))) {
                return headers;
            }
        }
        String publicKey = environment.get(ENV_LANGFUSE_PUBLIC_KEY);
        String secretKey = environment.get(ENV_LANGFUSE_SECRET_KEY);
        if (publicKey == null || secretKey == null) {
            return headers;
        }
        String encoded = Base64.getEncoder()
                .encodeToString((publicKey + ":" + secretKey).getBytes(StandardCharsets.UTF_8));
        Map<String, String> enriched = new HashMap<>(headers);
        enriched.put("Authorization", "Basic " + encoded);
        return enriched;
    }

    private static String firstNonBlank(String a, String b) {
        if (a != null && !a.isBlank()) {
            return a.trim();
        }
        if (b != null && !b.isBlank()) {
            return b.trim();
        }
        return null;
    }
}
