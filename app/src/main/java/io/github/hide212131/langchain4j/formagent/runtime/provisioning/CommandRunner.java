package io.github.hide212131.langchain4j.formagent.runtime.provisioning;

import java.time.Duration;
import java.util.List;

/** Seam over external process execution so the Docker provisioner can be exercised without Docker. */
@FunctionalInterface
interface CommandRunner {

    /**
     * Runs {@code command} to completion or until {@code timeout} elapses.
     *
     * @throws io.github.hide212131.langchain4j.formagent.runtime.agent.ResourceAcquisitionException when the
     *     process cannot be started, is interrupted, or outlives {@code timeout}
     */
    ProcessResult run(List<String> command, String logicalCommand, Duration timeout);
}
