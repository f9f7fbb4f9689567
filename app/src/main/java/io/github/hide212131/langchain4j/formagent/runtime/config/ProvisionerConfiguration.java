package io.github.hide212131.langchain4j.formagent.runtime.config;

import java.util.Objects;

/** Which provisioner to wire, and the container image used by the Docker one. */
public record ProvisionerConfiguration(ProvisionerType type, String dockerImage) {

    public static final String DEFAULT_DOCKER_IMAGE = "alpine:3.20";

    static final String ENV_RESOURCE_PROVISIONER = "RESOURCE_PROVISIONER";
    static final String ENV_RESOURCE_DOCKER_IMAGE = "RESOURCE_DOCKER_IMAGE";

    public ProvisionerConfiguration {
        Objects.requireNonNull(type, "type");
        dockerImage = dockerImage == null || dockerImage.isBlank() ? DEFAULT_DOCKER_IMAGE : dockerImage;
    }

    public static ProvisionerConfiguration load(EnvironmentResolver environment, ProvisionerType override) {
        Objects.requireNonNull(environment, "environment");
        ProvisionerType type;
        try {
            type = override != null ? override : ProvisionerType.parse(environment.get(ENV_RESOURCE_PROVISIONER));
        } catch (IllegalArgumentException ex) {
            throw new ConfigurationException(ex.getMessage(), ex);
        }
        return new ProvisionerConfiguration(type, environment.get(ENV_RESOURCE_DOCKER_IMAGE));
    }
}
