package io.github.hide212131.langchain4j.formagent.runtime.provisioning;

import io.github.hide212131.langchain4j.formagent.runtime.agent.ResourceAcquisitionException;
import io.github.hide212131.langchain4j.formagent.runtime.agent.ResourceHandle;
import io.github.hide212131.langchain4j.formagent.runtime.agent.ResourceProvisioner;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Provisions an isolated, network-less Docker container per run and stops it on release. The container id is
 * the resource id. {@code diskGb} is not applied since storage quotas depend on the storage driver.
 *
 * <p>{@code docker run} may take until the resource's auto-stop (at most {@link #START_TIMEOUT}) to come back;
 * past that the container would already be gone.</p>
 */
public final class DockerResourceProvisioner implements ResourceProvisioner {

    private static final Logger LOGGER = LoggerFactory.getLogger(DockerResourceProvisioner.class);
    private static final String DOCKER_COMMAND = "docker";
    static final Duration VERSION_TIMEOUT = Duration.ofSeconds(30);
    static final Duration START_TIMEOUT = Duration.ofMinutes(5);
    static final Duration STOP_TIMEOUT = Duration.ofSeconds(30);

    private final String imageTag;
    private final CommandRunner commandRunner;

    public DockerResourceProvisioner(String imageTag) {
        this(imageTag, new ProcessCommandRunner());
    }

    DockerResourceProvisioner(String imageTag, CommandRunner commandRunner) {
        this.imageTag = Objects.requireNonNull(imageTag, "imageTag");
        this.commandRunner = Objects.requireNonNull(commandRunner, "commandRunner");
    }

    @Override
    public ResourceHandle acquire(Object config) {
        ResourceConfig resourceConfig;
        try {
            resourceConfig = ResourceConfig.from(config);
        } catch (IllegalArgumentException ex) {
            throw new ResourceAcquisitionException(ex.getMessage(), ex);
        }
        ensureDockerAvailable();
        ProcessResult result = commandRunner.run(runCommand(resourceConfig), "docker run",
                startTimeout(resourceConfig));
        if (result.exitCode() != 0 || result.stdout().isBlank()) {
            throw new ResourceAcquisitionException(
                    "Docker コンテナの起動に失敗しました: " + imageTag + " " + result.stderr().trim());
        }
        String containerId = result.stdout().trim();
        LOGGER.info("Started container {} from {}", containerId, imageTag);
        return new ResourceHandle(containerId);
    }

    @Override
    public void release(String resourceId) {
        if (resourceId == null || resourceId.isBlank()) {
            return;
        }
        ProcessResult result;
        try {
            result = commandRunner.run(List.of(DOCKER_COMMAND, "stop", resourceId), "docker stop", STOP_TIMEOUT);
        } catch (ResourceAcquisitionException ex) {
            throw new IllegalStateException("Docker コンテナの停止に失敗しました: " + resourceId, ex);
        }
        if (result.exitCode() != 0) {
            throw new IllegalStateException("Docker コンテナの停止に失敗しました: " + resourceId);
        }
        LOGGER.info("Stopped container {}", resourceId);
    }

    List<String> runCommand(ResourceConfig config) {
        List<String> command = new ArrayList<>(List.of(DOCKER_COMMAND, "run", "-d", "--network", "none"));
        if (!Boolean.FALSE.equals(config.ephemeral())) {
            command.add("--rm");
        }
        if (config.cpu() != null) {
            command.add("--cpus");
            command.add(String.valueOf(config.cpu()));
        }
        if (config.memoryGb() != null) {
            command.add("--memory");
            command.add(config.memoryGb() + "g");
        }
        command.add(imageTag);
        // the container exits by itself after autoStopMinutes; --rm then removes it
        command.add("sleep");
        command.add(config.autoStopMinutes() == null ? "infinity" : String.valueOf(config.autoStopMinutes() * 60));
        return command;
    }

    static Duration startTimeout(ResourceConfig config) {
        if (config.autoStopMinutes() == null || config.autoStopMinutes() <= 0) {
            return START_TIMEOUT;
        }
        Duration autoStop = Duration.ofMinutes(config.autoStopMinutes());
        return autoStop.compareTo(START_TIMEOUT) < 0 ? autoStop : START_TIMEOUT;
    }

    private void ensureDockerAvailable() {
        ProcessResult result = commandRunner.run(
                List.of(DOCKER_COMMAND, "version", "--format", "{{.Server.Version}}"), "docker version",
                VERSION_TIMEOUT);
        if (result.exitCode() != 0) {
            throw new ResourceAcquisitionException("Docker が利用できません");
        }
    }
}
