package io.github.hide212131.langchain4j.formagent.runtime.agent;

import java.util.Objects;

/** Identifier of an ephemeral resource, exclusively owned by the run that acquired it. */
public record ResourceHandle(String id) {

    public ResourceHandle {
        Objects.requireNonNull(id, "id");
        if (id.isBlank()) {
            throw new IllegalArgumentException("resource id は空にできません");
        }
    }
}
