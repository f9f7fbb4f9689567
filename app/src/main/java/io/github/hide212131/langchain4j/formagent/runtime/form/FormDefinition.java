package io.github.hide212131.langchain4j.formagent.runtime.form;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/** Normalised form: identifier, optional title and top-level fields in display order. */
public record FormDefinition(String formId, String title, List<FieldDefinition> fields) {

    public FormDefinition {
        Objects.requireNonNull(formId, "formId");
        if (formId.isBlank()) {
            throw new IllegalArgumentException("Invalid formId: formId must be a non-empty string");
        }
        fields = List.copyOf(Objects.requireNonNull(fields, "fields"));
        Set<String> seen = new HashSet<>();
        for (FieldDefinition field : fields) {
            if (!seen.add(field.id())) {
                throw new IllegalArgumentException("フォーム " + formId + " 内でフィールド ID が重複しています: " + field.id());
            }
        }
    }
}
