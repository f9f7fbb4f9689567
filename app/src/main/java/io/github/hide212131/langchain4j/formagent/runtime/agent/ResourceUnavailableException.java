package io.github.hide212131.langchain4j.formagent.runtime.agent;

/**
 * The task requires a resource but no {@link ResourceProvisioner} was wired into the runner.
 */
public class ResourceUnavailableException extends ResourceAcquisitionException {

    public ResourceUnavailableException(String message) {
        super(message);
    }
}
