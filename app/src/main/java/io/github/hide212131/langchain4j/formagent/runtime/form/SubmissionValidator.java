package io.github.hide212131.langchain4j.formagent.runtime.form;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Validates a submitted value tree against a field tree, collecting every violation.
 *
 * <p>Keys that name no field are dropped from the accepted values (also inside group entries) and are not
 * reported. Within one field only the first violation is reported: a missing required value is not also
 * type-checked. All fields and all group entries are always visited.</p>
 *
 * <p>Stateless; safe to share between threads.</p>
 */
public final class SubmissionValidator {

    public ValidationResult validate(FormDefinition form, Map<String, ?> values) {
        Objects.requireNonNull(form, "form");
        return validate(form.fields(), values);
    }

    public ValidationResult validate(List<? extends FieldDefinition> fields, Map<String, ?> values) {
        Objects.requireNonNull(fields, "fields");
        Map<String, ?> submitted = values == null ? Map.of() : values;
        Map<String, Object> accepted = retainKnown(submitted, fields);
        List<ValidationError> errors = new ArrayList<>();

        for (FieldDefinition field : fields) {
            Object value = submitted.get(field.id());
            if (field instanceof GroupField group) {
                validateGroup(group, value, accepted, errors);
            } else if (field instanceof ScalarField scalar) {
                validateScalar(scalar, value, scalar.id(), errors);
            }
        }
        return new ValidationResult(accepted, errors);
    }

    private void validateGroup(GroupField group, Object value, Map<String, Object> accepted,
            List<ValidationError> errors) {
        if (value == null) {
            if (group.required()) {
                errors.add(new ValidationError(group.id(), group.label() + " is required"));
            }
            return;
        }
        if (!(value instanceof List<?> entries)) {
            errors.add(new ValidationError(group.id(), group.label() + " must be an array"));
            return;
        }
        if (entries.isEmpty()) {
            if (group.required()) {
                errors.add(new ValidationError(group.id(), group.label() + " is required"));
            }
            return;
        }

        List<Object> acceptedEntries = new ArrayList<>(entries.size());
        for (int i = 0; i < entries.size(); i++) {
            Object entry = entries.get(i);
            String entryPath = group.id() + "[" + i + "]";
            if (!(entry instanceof Map<?, ?> instance)) {
                errors.add(new ValidationError(entryPath, group.label() + " entry " + (i + 1) + " must be an object"));
                acceptedEntries.add(entry);
                continue;
            }
            for (ScalarField child : group.children()) {
                validateScalar(child, instance.get(child.id()), entryPath + "." + child.id(), errors);
            }
            acceptedEntries.add(retainKnown(instance, group.children()));
        }
        accepted.put(group.id(), acceptedEntries);
    }

    private void validateScalar(ScalarField field, Object value, String path, List<ValidationError> errors) {
        if (isMissing(value)) {
            if (field.required()) {
                errors.add(new ValidationError(path, field.label() + " is required"));
            }
            return;
        }
        String violation = typeViolation(field, value);
        if (violation != null) {
            errors.add(new ValidationError(path, field.label() + violation));
        }
    }

    private String typeViolation(ScalarField field, Object value) {
        return switch (field.kind()) {
        case BOOLEAN -> value instanceof Boolean ? null : " must be a boolean";
        case TEXT -> value instanceof String ? null : " must be a string";
        case DATE -> value instanceof String ? null : " must be a date string";
        case CHOICE -> {
            if (!(value instanceof String text)) {
                yield " must be a string";
            }
            yield field.allows(text) ? null : " must be one of the allowed options";
        }
        case GROUP -> throw new IllegalStateException("group はスカラーとして検証できません: " + field.id());
        };
    }

    private static boolean isMissing(Object value) {
        return value == null || "".equals(value);
    }

    private static Map<String, Object> retainKnown(Map<?, ?> values, List<? extends FieldDefinition> fields) {
        Set<String> known = fields.stream().map(FieldDefinition::id).collect(Collectors.toSet());
        Map<String, Object> retained = new LinkedHashMap<>();
        values.forEach((key, value) -> {
            if (key instanceof String id && known.contains(id)) {
                retained.put(id, value);
            }
        });
        return retained;
    }
}
