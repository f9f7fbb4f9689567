package io.github.hide212131.langchain4j.formagent.runtime.generation;

import io.github.hide212131.langchain4j.formagent.runtime.form.FormDefinition;
import java.util.Map;
import java.util.Objects;

/** A generated form plus the metadata of the run that produced it. */
public record GeneratedForm(FormDefinition form, Map<String, Object> runMetadata) {

    public GeneratedForm {
        Objects.requireNonNull(form, "form");
        runMetadata = runMetadata == null ? Map.of() : runMetadata;
    }
}
