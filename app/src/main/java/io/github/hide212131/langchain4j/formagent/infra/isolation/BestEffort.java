package io.github.hide212131.langchain4j.formagent.infra.isolation;

import io.github.hide212131.langchain4j.formagent.infra.logging.RunLogger;
import java.util.Objects;

/**
 * Runs secondary actions whose failure must never change the outcome of the surrounding operation.
 * Every failure is logged at WARN and then dropped.
 *
 * <p>Only {@link VirtualMachineError} (out of memory, stack overflow) passes through, since the JVM cannot be
 * trusted to finish the surrounding operation after one.</p>
 */
public final class BestEffort {

    private final RunLogger log;

    public BestEffort(RunLogger log) {
        this.log = Objects.requireNonNull(log, "log");
    }

    /**
     * Executes {@code action}, isolating anything it throws except a {@link VirtualMachineError}.
     *
     * @return {@code true} when the action completed normally
     */
    @SuppressWarnings({"PMD.AvoidCatchingGenericException", "PMD.AvoidCatchingThrowable"})
    public boolean run(String runId, String step, Runnable action) {
        Objects.requireNonNull(action, "action");
        try {
            action.run();
            return true;
        } catch (VirtualMachineError fatal) {
            throw fatal;
        } catch (Throwable ex) {
            log.warn(runId, "secondary", step, "best-effort action failed; outcome unchanged", ex);
            return false;
        }
    }
}
