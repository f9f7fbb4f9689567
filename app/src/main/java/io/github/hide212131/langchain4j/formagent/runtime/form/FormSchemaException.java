package io.github.hide212131.langchain4j.formagent.runtime.form;

/**
 * フォーム定義（フィールドツリー）の構造が不正な場合の例外。
 */
public class FormSchemaException extends RuntimeException {

    public FormSchemaException(String message) {
        super(message);
    }

    public FormSchemaException(String message, Throwable cause) {
        super(message, cause);
    }
}
