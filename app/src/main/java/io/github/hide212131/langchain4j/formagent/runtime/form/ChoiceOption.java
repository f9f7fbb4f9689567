package io.github.hide212131.langchain4j.formagent.runtime.form;

import java.util.Objects;

/** One selectable (value, label) pair of a choice field. */
public record ChoiceOption(String value, String label) {

    public ChoiceOption {
        Objects.requireNonNull(value, "value");
        label = label == null ? value : label;
    }
}
