package io.github.hide212131.langchain4j.formagent.runtime.config;

import java.time.Duration;
import java.util.Objects;

/** LLM プロバイダ切替に必要な設定値。 */
public record LlmConfiguration(LlmProvider provider, String openAiApiKey, String openAiBaseUrl, String openAiModel,
        Duration timeout) {

    public static final String DEFAULT_MODEL = "gpt-5-mini";
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(120);

    private static final int MASK_THRESHOLD = 8;
    private static final int MASK_SUFFIX_LENGTH = 4;

    public LlmConfiguration {
        Objects.requireNonNull(provider, "provider");
        openAiModel = openAiModel == null ? DEFAULT_MODEL : openAiModel;
        timeout = timeout == null ? DEFAULT_TIMEOUT : timeout;
    }

    public static LlmConfiguration mock() {
        return new LlmConfiguration(LlmProvider.MOCK, null, null, null, null);
    }

    public String maskedApiKey() {
        if (openAiApiKey == null || openAiApiKey.isBlank()) {
            return "(none)";
        }
        if (openAiApiKey.length() <= MASK_THRESHOLD) {
            return "****";
        }
        String last = openAiApiKey.substring(openAiApiKey.length() - MASK_SUFFIX_LENGTH);
        return "****" + last;
    }
}
