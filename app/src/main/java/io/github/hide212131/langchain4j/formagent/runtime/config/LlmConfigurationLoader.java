package io.github.hide212131.langchain4j.formagent.runtime.config;

import java.time.Duration;
import java.util.Objects;

/**
 * 環境変数 / .env から LLM 設定を解決する。
 */
public final class LlmConfigurationLoader {

    static final String ENV_LLM_PROVIDER = "LLM_PROVIDER";
    static final String ENV_OPENAI_API_KEY = "OPENAI_API_KEY";
    static final String ENV_OPENAI_BASE_URL = "OPENAI_BASE_URL";
    static final String ENV_OPENAI_MODEL = "OPENAI_MODEL";
    static final String ENV_OPENAI_TIMEOUT_SECONDS = "OPENAI_TIMEOUT_SECONDS";

    private final EnvironmentResolver environment;

    public LlmConfigurationLoader() {
        this(EnvironmentResolver.system());
    }

    public LlmConfigurationLoader(EnvironmentResolver environment) {
        this.environment = Objects.requireNonNull(environment, "environment");
    }

    public LlmConfiguration load() {
        return load(null);
    }

    public LlmConfiguration load(LlmProvider overrideProvider) {
        LlmProvider provider;
        try {
            provider = overrideProvider != null ? overrideProvider : LlmProvider.from(environment.get(ENV_LLM_PROVIDER));
        } catch (IllegalArgumentException ex) {
            throw new ConfigurationException(ex.getMessage(), ex);
        }
        String apiKey = environment.get(ENV_OPENAI_API_KEY);
        if (provider == LlmProvider.OPENAI && apiKey == null) {
            throw new ConfigurationException("LLM_PROVIDER=openai の場合、OPENAI_API_KEY が必須です");
        }
        return new LlmConfiguration(provider, apiKey, environment.get(ENV_OPENAI_BASE_URL),
                environment.get(ENV_OPENAI_MODEL), resolveTimeout());
    }

    private Duration resolveTimeout() {
        String raw = environment.get(ENV_OPENAI_TIMEOUT_SECONDS);
        if (raw == null) {
            return LlmConfiguration.DEFAULT_TIMEOUT;
        }
        long seconds;
        try {
            seconds = Long.parseLong(raw);
        } catch (NumberFormatException ex) {
            throw new ConfigurationException("OPENAI_TIMEOUT_SECONDS must be a positive integer (seconds)", ex);
        }
        if (seconds <= 0) {
            throw new ConfigurationException("OPENAI_TIMEOUT_SECONDS must be greater than zero");
        }
        return Duration.ofSeconds(seconds);
    }
}
