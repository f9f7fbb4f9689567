package io.github.hide212131.langchain4j.formagent.runtime.agent;

import io.github.hide212131.langchain4j.formagent.infra.logging.RunLogger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/** State holder for one invocation of {@link AgentRunner#run}. Not reusable and not shared across threads. */
final class AgentRun {

    private final String runId;
    private final RunLogger log;
    private final List<RunState> history = new ArrayList<>();
    private RunState state = RunState.NOT_STARTED;

    AgentRun(String runId, RunLogger log) {
        this.runId = Objects.requireNonNull(runId, "runId");
        this.log = Objects.requireNonNull(log, "log");
        history.add(state);
    }

    String runId() {
        return runId;
    }

    RunState state() {
        return state;
    }

    List<RunState> history() {
        return Collections.unmodifiableList(history);
    }

    void advance(RunState next) {
        if (!state.canAdvanceTo(next)) {
            throw new IllegalStateException("不正な状態遷移です: " + state + " -> " + next + " (run=" + runId + ")");
        }
        log.debug(runId, "lifecycle", "state", state + " -> " + next, null);
        state = next;
        history.add(next);
    }

    /** Moves into {@link RunState#RELEASING}; a run interrupted while executing is recorded as failed first. */
    void beginRelease() {
        if (state == RunState.EXECUTING) {
            advance(RunState.FAILED);
        }
        advance(RunState.RELEASING);
    }

    void finish() {
        if (state == RunState.EXECUTING) {
            advance(RunState.FAILED);
        }
        advance(RunState.DONE);
    }
}
