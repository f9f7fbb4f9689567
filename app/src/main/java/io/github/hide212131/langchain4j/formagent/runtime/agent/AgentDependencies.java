package io.github.hide212131.langchain4j.formagent.runtime.agent;

import java.util.Objects;
import java.util.Optional;

/**
 * Collaborators wired into an {@link AgentRunner}. The backend is mandatory; the provisioner and the sink are
 * explicitly present or absent.
 */
public record AgentDependencies(ExecutionBackend backend, Optional<ResourceProvisioner> provisioner,
        Optional<ObservabilitySink> observability) {

    public AgentDependencies {
        Objects.requireNonNull(backend, "backend は必須です");
        provisioner = provisioner == null ? Optional.empty() : provisioner;
        observability = observability == null ? Optional.empty() : observability;
    }

    public static Builder builder(ExecutionBackend backend) {
        return new Builder(backend);
    }

    public static final class Builder {

        private final ExecutionBackend backend;
        private ResourceProvisioner provisioner;
        private ObservabilitySink observability;

        private Builder(ExecutionBackend backend) {
            this.backend = Objects.requireNonNull(backend, "backend は必須です");
        }

        public Builder provisioner(ResourceProvisioner provisioner) {
            this.provisioner = provisioner;
            return this;
        }

        public Builder observability(ObservabilitySink observability) {
            this.observability = observability;
            return this;
        }

        public AgentDependencies build() {
            return new AgentDependencies(backend, Optional.ofNullable(provisioner),
                    Optional.ofNullable(observability));
        }
    }
}
