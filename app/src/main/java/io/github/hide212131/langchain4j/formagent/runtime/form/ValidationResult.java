package io.github.hide212131.langchain4j.formagent.runtime.form;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Accepted (stripped) values plus every violation found. Valid when {@code errors} is empty. */
public record ValidationResult(Map<String, Object> acceptedValues, List<ValidationError> errors) {

    public ValidationResult {
        acceptedValues = Collections.unmodifiableMap(new LinkedHashMap<>(acceptedValues));
        errors = List.copyOf(errors);
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    /** One {@code path: message} line per error, in detection order. */
    public List<String> messages() {
        return errors.stream().map(ValidationError::toString).toList();
    }
}
