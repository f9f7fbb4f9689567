package io.github.hide212131.langchain4j.formagent.runtime.form;

/**
 * 送信データのエンベロープが不正な場合の例外。
 */
public class SubmissionFormatException extends RuntimeException {

    public SubmissionFormatException(String message) {
        super(message);
    }

    public SubmissionFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
