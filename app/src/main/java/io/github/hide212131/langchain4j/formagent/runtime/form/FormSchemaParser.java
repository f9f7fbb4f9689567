package io.github.hide212131.langchain4j.formagent.runtime.form;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Reads the form wire format into a {@link FormDefinition} and writes it back.
 *
 * <p>Wire shape: {@code {formId, title?, fields: [{id, type, label, required?, placeholder?, options?, order?,
 * fields?}]}} with {@code type} in text|date|dropdown|checkbox|dynamic. Only {@code dynamic} fields carry nested
 * {@code fields}, and those may not be {@code dynamic} themselves.</p>
 */
public final class FormSchemaParser {

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public FormSchemaParser() {
        this(new ObjectMapper());
    }

    public FormSchemaParser(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    public FormDefinition parse(String json) {
        if (json == null || json.isBlank()) {
            throw new FormSchemaException("Form definition is empty");
        }
        Map<String, Object> raw;
        try {
            raw = objectMapper.readValue(json, MAP_TYPE);
        } catch (JsonProcessingException ex) {
            throw new FormSchemaException("Form definition is not valid JSON: " + ex.getOriginalMessage(), ex);
        }
        return parse(raw);
    }

    public FormDefinition parse(Map<String, ?> raw) {
        if (raw == null) {
            throw new FormSchemaException("Invalid form data structure");
        }
        Object formId = raw.get("formId");
        Object fields = raw.get("fields");
        if (!(formId instanceof String id) || id.isBlank() || !(fields instanceof List<?> rawFields)) {
            throw new FormSchemaException("Invalid form data structure: formId and fields are required");
        }

        List<FieldDefinition> normalized = new ArrayList<>(rawFields.size());
        for (int index = 0; index < rawFields.size(); index++) {
            normalized.add(parseField(rawFields.get(index), index));
        }
        requireUniqueIds(normalized.stream().map(FieldDefinition::id).toList(), "form " + id);
        normalized.sort(Comparator.comparingInt(FieldDefinition::order));
        return new FormDefinition(id.trim(), stringOrNull(raw.get("title")), normalized);
    }

    public Map<String, Object> toWire(FormDefinition form) {
        Objects.requireNonNull(form, "form");
        Map<String, Object> wire = new LinkedHashMap<>();
        wire.put("formId", form.formId());
        if (form.title() != null) {
            wire.put("title", form.title());
        }
        wire.put("fields", form.fields().stream().map(this::fieldToWire).toList());
        return wire;
    }

    public String toJson(FormDefinition form) {
        try {
            return objectMapper.writer(SerializationFeature.INDENT_OUTPUT).writeValueAsString(toWire(form));
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("フォーム定義を JSON に変換できません: " + form.formId(), ex);
        }
    }

    private FieldDefinition parseField(Object rawField, int index) {
        if (!(rawField instanceof Map<?, ?> field) || isBlank(field.get("id")) || isBlank(field.get("type"))
                || isBlank(field.get("label"))) {
            throw new FormSchemaException("Invalid field at index " + index + ": missing id, type, or label");
        }
        String id = field.get("id").toString().trim();
        FieldKind kind = FieldKind.fromWireName(field.get("type").toString());
        if (kind == null) {
            throw new FormSchemaException("Invalid field type: " + field.get("type"));
        }
        int order = orderOrDefault(field.get("order"), index + 1);
        if (kind != FieldKind.GROUP) {
            return scalar(field, id, kind, order);
        }

        if (!(field.get("fields") instanceof List<?> nestedFields)) {
            throw new FormSchemaException("Dynamic field \"" + id + "\" must have a \"fields\" array");
        }
        List<ScalarField> children = new ArrayList<>(nestedFields.size());
        for (int nestedIndex = 0; nestedIndex < nestedFields.size(); nestedIndex++) {
            children.add(parseNestedField(id, nestedFields.get(nestedIndex), nestedIndex));
        }
        requireUniqueIds(children.stream().map(ScalarField::id).toList(), "dynamic field \"" + id + "\"");
        return new GroupField(id, field.get("label").toString(), asBoolean(field.get("required")),
                stringOrNull(field.get("placeholder")), order, children);
    }

    private ScalarField parseNestedField(String groupId, Object rawNested, int index) {
        if (!(rawNested instanceof Map<?, ?> nested) || isBlank(nested.get("id")) || isBlank(nested.get("type"))
                || isBlank(nested.get("label"))) {
            throw new FormSchemaException(
                    "Invalid nested field in dynamic field \"" + groupId + "\": missing id, type, or label");
        }
        FieldKind kind = FieldKind.fromWireName(nested.get("type").toString());
        if (kind == null || !kind.isScalar()) {
            throw new FormSchemaException(
                    "Invalid nested field type in dynamic field \"" + groupId + "\": " + nested.get("type"));
        }
        return scalar(nested, nested.get("id").toString().trim(), kind, orderOrDefault(nested.get("order"),
                index + 1));
    }

    private ScalarField scalar(Map<?, ?> field, String id, FieldKind kind, int order) {
        List<ChoiceOption> options = kind == FieldKind.CHOICE ? options(id, field.get("options")) : List.of();
        return new ScalarField(id, kind, field.get("label").toString(), asBoolean(field.get("required")),
                stringOrNull(field.get("placeholder")), options, order);
    }

    private List<ChoiceOption> options(String fieldId, Object rawOptions) {
        if (rawOptions == null) {
            return null;
        }
        if (!(rawOptions instanceof List<?> entries)) {
            throw new FormSchemaException("Field \"" + fieldId + "\" options must be an array");
        }
        List<ChoiceOption> options = new ArrayList<>(entries.size());
        for (Object entry : entries) {
            if (!(entry instanceof Map<?, ?> option) || option.get("value") == null) {
                throw new FormSchemaException("Field \"" + fieldId + "\" has an option without a value");
            }
            options.add(new ChoiceOption(option.get("value").toString(), stringOrNull(option.get("label"))));
        }
        return options;
    }

    private Map<String, Object> fieldToWire(FieldDefinition field) {
        Map<String, Object> wire = new LinkedHashMap<>();
        wire.put("id", field.id());
        wire.put("type", field.kind().wireName());
        wire.put("label", field.label());
        wire.put("required", field.required());
        if (field.placeholder() != null) {
            wire.put("placeholder", field.placeholder());
        }
        if (field instanceof ScalarField scalar && scalar.kind() == FieldKind.CHOICE && scalar.options() != null) {
            wire.put("options", scalar.options().stream().map(option -> {
                Map<String, Object> entry = new LinkedHashMap<>();
                entry.put("value", option.value());
                entry.put("label", option.label());
                return entry;
            }).toList());
        }
        wire.put("order", field.order());
        if (field instanceof GroupField group) {
            wire.put("fields", group.children().stream().map(child -> {
                Map<String, Object> nested = fieldToWire(child);
                nested.remove("order");
                return nested;
            }).toList());
        }
        return wire;
    }

    private static void requireUniqueIds(List<String> ids, String scope) {
        Set<String> seen = new HashSet<>();
        for (String id : ids) {
            if (!seen.add(id)) {
                throw new FormSchemaException("Duplicate field id \"" + id + "\" in " + scope);
            }
        }
    }

    private static int orderOrDefault(Object raw, int fallback) {
        if (raw instanceof Number number) {
            return number.intValue();
        }
        if (raw instanceof String text && !text.isBlank()) {
            try {
                return Integer.parseInt(text.trim());
            } catch (NumberFormatException ex) {
                throw new FormSchemaException("Field order must be an integer: " + text, ex);
            }
        }
        return fallback;
    }

    private static boolean asBoolean(Object raw) {
        if (raw instanceof Boolean flag) {
            return flag;
        }
        return raw instanceof String text && Boolean.parseBoolean(text.trim());
    }

    private static boolean isBlank(Object value) {
        return value == null || value.toString().isBlank();
    }

    private static String stringOrNull(Object value) {
        return value == null ? null : value.toString();
    }
}
