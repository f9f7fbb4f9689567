package io.github.hide212131.langchain4j.formagent.runtime.form;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** Reads the submission envelope {@code {"data": {...}}} into a mutable value tree. */
public final class SubmissionParser {

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public SubmissionParser() {
        this(new ObjectMapper());
    }

    public SubmissionParser(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    public Map<String, Object> parse(String json) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json == null ? "" : json);
        } catch (JsonProcessingException ex) {
            throw new SubmissionFormatException("Submission is not valid JSON", ex);
        }
        JsonNode data = root == null ? null : root.get("data");
        if (data == null || !data.isObject()) {
            throw new SubmissionFormatException("Form data is required");
        }
        return objectMapper.convertValue(data, MAP_TYPE);
    }
}
