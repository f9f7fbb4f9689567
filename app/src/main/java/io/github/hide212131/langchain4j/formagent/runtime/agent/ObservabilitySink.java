package io.github.hide212131.langchain4j.formagent.runtime.agent;

/**
 * Records the outcome of a run. Implementations may fail; callers treat any exception as non-fatal.
 */
@FunctionalInterface
public interface ObservabilitySink {

    void record(RunEvent event);
}
