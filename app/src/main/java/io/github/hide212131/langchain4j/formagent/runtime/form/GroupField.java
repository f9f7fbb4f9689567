package io.github.hide212131.langchain4j.formagent.runtime.form;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/** Repeatable group; each submitted instance is validated against {@code children}. */
public record GroupField(String id, String label, boolean required, String placeholder, int order,
        List<ScalarField> children) implements FieldDefinition {

    public GroupField {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(label, "label");
        children = List.copyOf(Objects.requireNonNull(children, "children"));
        Set<String> seen = new HashSet<>();
        for (ScalarField child : children) {
            if (!seen.add(child.id())) {
                throw new IllegalArgumentException("グループ " + id + " 内でフィールド ID が重複しています: " + child.id());
            }
        }
    }

    public static GroupField of(String id, String label, boolean required, List<ScalarField> children) {
        return new GroupField(id, label, required, null, 1, children);
    }

    @Override
    public FieldKind kind() {
        return FieldKind.GROUP;
    }
}
