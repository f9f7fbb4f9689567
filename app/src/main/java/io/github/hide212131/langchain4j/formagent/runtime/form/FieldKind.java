package io.github.hide212131.langchain4j.formagent.runtime.form;

import java.util.Locale;

/** Field kinds together with their wire names. Only {@link #GROUP} may carry children. */
public enum FieldKind {
    TEXT("text"),
    DATE("date"),
    CHOICE("dropdown"),
    BOOLEAN("checkbox"),
    GROUP("dynamic");

    private final String wireName;

    FieldKind(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public boolean isScalar() {
        return this != GROUP;
    }

    /** @return the kind for {@code value}, or {@code null} when it names no known kind */
    public static FieldKind fromWireName(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (FieldKind kind : values()) {
            if (kind.wireName.equals(normalized)) {
                return kind;
            }
        }
        return null;
    }
}
