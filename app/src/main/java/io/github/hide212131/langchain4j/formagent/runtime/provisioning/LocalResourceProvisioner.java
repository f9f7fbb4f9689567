package io.github.hide212131.langchain4j.formagent.runtime.provisioning;

import io.github.hide212131.langchain4j.formagent.runtime.agent.ResourceAcquisitionException;
import io.github.hide212131.langchain4j.formagent.runtime.agent.ResourceHandle;
import io.github.hide212131.langchain4j.formagent.runtime.agent.ResourceProvisioner;
import java.time.Clock;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-process provisioner that only hands out identifiers ({@code sandbox-<epochMillis>-<random>}) and tracks
 * which of them are live. Used when no real isolation is needed.
 */
public final class LocalResourceProvisioner implements ResourceProvisioner {

    private static final Logger LOGGER = LoggerFactory.getLogger(LocalResourceProvisioner.class);
    private static final int SUFFIX_RADIX = 36;

    private final Clock clock;
    private final Map<String, ResourceConfig> live = new ConcurrentHashMap<>();

    public LocalResourceProvisioner() {
        this(Clock.systemUTC());
    }

    LocalResourceProvisioner(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public ResourceHandle acquire(Object config) {
        ResourceConfig resourceConfig;
        try {
            resourceConfig = ResourceConfig.from(config);
        } catch (IllegalArgumentException ex) {
            throw new ResourceAcquisitionException(ex.getMessage(), ex);
        }
        String id;
        do {
            id = "sandbox-" + clock.millis() + "-"
                    + Long.toString(ThreadLocalRandom.current().nextLong(Long.MAX_VALUE), SUFFIX_RADIX);
        } while (live.putIfAbsent(id, resourceConfig) != null);
        LOGGER.debug("Created sandbox {} with {}", id, resourceConfig);
        return new ResourceHandle(id);
    }

    @Override
    public void release(String resourceId) {
        if (live.remove(resourceId) == null) {
            throw new IllegalStateException("未知のリソースです: " + resourceId);
        }
        LOGGER.debug("Stopped sandbox {}", resourceId);
    }

    public boolean isLive(String resourceId) {
        return live.containsKey(resourceId);
    }

    public int liveCount() {
        return live.size();
    }
}
