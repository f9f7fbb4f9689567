package io.github.hide212131.langchain4j.formagent.runtime.agent;

/**
 * 実行バックエンドでの処理が失敗した場合の例外。
 */
public class BackendFailureException extends AgentRunException {

    public BackendFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
