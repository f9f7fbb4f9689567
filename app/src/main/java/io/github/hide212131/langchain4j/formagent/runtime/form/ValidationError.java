package io.github.hide212131.langchain4j.formagent.runtime.form;

import java.util.Objects;

/** One violation. {@code fieldPath} is a field id or {@code groupId[index].childId}. */
public record ValidationError(String fieldPath, String message) {

    public ValidationError {
        Objects.requireNonNull(fieldPath, "fieldPath");
        Objects.requireNonNull(message, "message");
    }

    @Override
    public String toString() {
        return fieldPath + ": " + message;
    }
}
