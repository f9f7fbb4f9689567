package io.github.hide212131.langchain4j.formagent.runtime.config;

/**
 * 実行に必要な設定の読み込みに失敗した場合の例外。
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
