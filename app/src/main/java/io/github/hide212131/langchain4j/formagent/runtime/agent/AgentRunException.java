package io.github.hide212131.langchain4j.formagent.runtime.agent;

/**
 * エージェント実行が失敗した場合の例外の基底クラス。
 */
public class AgentRunException extends RuntimeException {

    public AgentRunException(String message) {
        super(message);
    }

    public AgentRunException(String message, Throwable cause) {
        super(message, cause);
    }
}
