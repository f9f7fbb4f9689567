package io.github.hide212131.langchain4j.formagent.runtime.provisioning;

import io.github.hide212131.langchain4j.formagent.runtime.agent.ResourceAcquisitionException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs provisioning CLI calls (docker) as child processes.
 *
 * <p>Both output streams drain on one daemon pool shared by every runner, so a call costs no thread set-up.
 * A process still alive at its deadline is killed. Start failures, interruption and deadline overruns surface as
 * {@link ResourceAcquisitionException}; a non-zero exit code is returned for the caller to judge.</p>
 */
@SuppressWarnings("PMD.CloseResource")
final class ProcessCommandRunner implements CommandRunner {

    private static final Logger LOGGER = LoggerFactory.getLogger(ProcessCommandRunner.class);
    private static final Duration OUTPUT_GRACE = Duration.ofSeconds(5);
    private static final ExecutorService OUTPUT_DRAIN = Executors.newCachedThreadPool(runnable -> {
        Thread thread = new Thread(runnable, "provisioning-output-drain");
        thread.setDaemon(true);
        return thread;
    });

    @Override
    public ProcessResult run(List<String> command, String logicalCommand, Duration timeout) {
        Objects.requireNonNull(command, "command");
        Objects.requireNonNull(logicalCommand, "logicalCommand");
        Objects.requireNonNull(timeout, "timeout");
        long startedAt = System.nanoTime();
        Process process = start(command, logicalCommand);
        Future<String> stdout = OUTPUT_DRAIN.submit(() -> drain(process.getInputStream()));
        Future<String> stderr = OUTPUT_DRAIN.submit(() -> drain(process.getErrorStream()));
        if (!awaitExit(process, logicalCommand, timeout)) {
            process.destroyForcibly();
            stdout.cancel(true);
            stderr.cancel(true);
            LOGGER.warn("{} exceeded {} ms and was killed", logicalCommand, timeout.toMillis());
            throw new ResourceAcquisitionException(
                    logicalCommand + " が " + timeout.toMillis() + " ms 以内に終了しませんでした");
        }
        ProcessResult result = new ProcessResult(logicalCommand, process.exitValue(),
                collect(stdout, logicalCommand), collect(stderr, logicalCommand),
                Duration.ofNanos(System.nanoTime() - startedAt).toMillis());
        LOGGER.debug("{} exited with {} in {} ms", logicalCommand, result.exitCode(), result.elapsedMs());
        return result;
    }

    private static Process start(List<String> command, String logicalCommand) {
        try {
            return new ProcessBuilder(command).start();
        } catch (IOException ex) {
            throw new ResourceAcquisitionException(logicalCommand + " を起動できません: " + ex.getMessage(), ex);
        }
    }

    private static boolean awaitExit(Process process, String logicalCommand, Duration timeout) {
        try {
            return process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new ResourceAcquisitionException(logicalCommand + " の待機中に割り込まれました", ex);
        }
    }

    private static String collect(Future<String> output, String logicalCommand) {
        try {
            return output.get(OUTPUT_GRACE.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new ResourceAcquisitionException(logicalCommand + " の出力取得中に割り込まれました", ex);
        } catch (ExecutionException | TimeoutException ex) {
            throw new ResourceAcquisitionException(logicalCommand + " の出力を取得できません", ex);
        }
    }

    private static String drain(InputStream stream) throws IOException {
        try (InputStream input = stream) {
            return new String(input.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
