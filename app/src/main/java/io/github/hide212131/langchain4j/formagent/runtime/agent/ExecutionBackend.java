package io.github.hide212131.langchain4j.formagent.runtime.agent;

/** Performs the actual unit of work. */
@FunctionalInterface
public interface ExecutionBackend {

    /**
     * @throws BackendFailureException when the work fails; the underlying error is kept as cause
     */
    TaskOutput run(String instructions, TaskInput input);
}
