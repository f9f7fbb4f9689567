package io.github.hide212131.langchain4j.formagent.runtime.agent;

/** Acquires and releases ephemeral execution resources. */
public interface ResourceProvisioner {

    /**
     * Provisions a new resource.
     *
     * @param config opaque configuration taken from {@link TaskDefinition#resourceConfig()}, may be {@code null}
     * @throws ResourceAcquisitionException when provisioning fails
     */
    ResourceHandle acquire(Object config);

    /** Releases a resource previously returned by {@link #acquire(Object)}. Failures surface as exceptions. */
    void release(String resourceId);
}
