package io.github.hide212131.langchain4j.formagent.runtime.agent;

/**
 * リソースの確保に失敗した場合の例外。バックエンドは呼び出されない。
 */
public class ResourceAcquisitionException extends AgentRunException {

    public ResourceAcquisitionException(String message) {
        super(message);
    }

    public ResourceAcquisitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
