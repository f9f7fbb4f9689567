package io.github.hide212131.langchain4j.formagent.runtime.agent;

import io.github.hide212131.langchain4j.formagent.infra.isolation.BestEffort;

/**
 * Scope bound to a successful acquisition. Closing it releases the resource exactly once, isolating release
 * failures. The empty lease releases nothing.
 */
final class ResourceLease implements AutoCloseable {

    private static final ResourceLease NONE = new ResourceLease(null, null, null, null);

    private final ResourceHandle handle;
    private final ResourceProvisioner provisioner;
    private final BestEffort bestEffort;
    private final AgentRun run;
    private boolean released;

    private ResourceLease(ResourceHandle handle, ResourceProvisioner provisioner, BestEffort bestEffort,
            AgentRun run) {
        this.handle = handle;
        this.provisioner = provisioner;
        this.bestEffort = bestEffort;
        this.run = run;
    }

    static ResourceLease none() {
        return NONE;
    }

    static ResourceLease of(ResourceHandle handle, ResourceProvisioner provisioner, BestEffort bestEffort,
            AgentRun run) {
        return new ResourceLease(handle, provisioner, bestEffort, run);
    }

    boolean isHeld() {
        return handle != null;
    }

    String resourceId() {
        return handle == null ? null : handle.id();
    }

    @Override
    public void close() {
        if (handle == null || released) {
            return;
        }
        released = true;
        run.beginRelease();
        bestEffort.run(run.runId(), "resource.release", () -> provisioner.release(handle.id()));
    }
}
