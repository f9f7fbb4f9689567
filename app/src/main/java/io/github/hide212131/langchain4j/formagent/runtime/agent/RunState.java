package io.github.hide212131.langchain4j.formagent.runtime.agent;

import java.util.EnumSet;
import java.util.Set;

/** Lifecycle of a single run. {@link #DONE} is terminal. */
public enum RunState {
    NOT_STARTED,
    RESOURCE_PENDING,
    EXECUTING,
    SUCCEEDED,
    FAILED,
    RELEASING,
    DONE;

    boolean canAdvanceTo(RunState next) {
        return successors().contains(next);
    }

    private Set<RunState> successors() {
        return switch (this) {
        case NOT_STARTED -> EnumSet.of(RESOURCE_PENDING, EXECUTING);
        // acquisition failure ends the run without executing or releasing
        case RESOURCE_PENDING -> EnumSet.of(EXECUTING, DONE);
        case EXECUTING -> EnumSet.of(SUCCEEDED, FAILED);
        case SUCCEEDED, FAILED -> EnumSet.of(RELEASING, DONE);
        case RELEASING -> EnumSet.of(DONE);
        case DONE -> EnumSet.noneOf(RunState.class);
        };
    }
}
