package io.github.hide212131.langchain4j.formagent.runtime.form;

import java.util.List;
import java.util.Objects;

/**
 * text / date / choice / boolean field.
 *
 * <p>{@code options} is always empty for non-choice kinds. For {@link FieldKind#CHOICE} it is {@code null} when
 * the definition declares no options, which leaves the value unrestricted; a declared empty list accepts
 * nothing.</p>
 */
public record ScalarField(String id, FieldKind kind, String label, boolean required, String placeholder,
        List<ChoiceOption> options, int order) implements FieldDefinition {

    public ScalarField {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(label, "label");
        if (!kind.isScalar()) {
            throw new IllegalArgumentException("ScalarField に group 種別は指定できません: " + id);
        }
        if (kind != FieldKind.CHOICE) {
            options = List.of();
        } else if (options != null) {
            options = List.copyOf(options);
        }
    }

    public static ScalarField of(String id, FieldKind kind, String label, boolean required) {
        return new ScalarField(id, kind, label, required, null, List.of(), 1);
    }

    public static ScalarField choice(String id, String label, boolean required, List<ChoiceOption> options) {
        return new ScalarField(id, FieldKind.CHOICE, label, required, null, options, 1);
    }

    public boolean allows(String value) {
        return options == null || options.stream().anyMatch(option -> option.value().equals(value));
    }
}
