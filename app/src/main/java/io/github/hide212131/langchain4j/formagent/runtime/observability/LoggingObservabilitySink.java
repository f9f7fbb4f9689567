package io.github.hide212131.langchain4j.formagent.runtime.observability;

import io.github.hide212131.langchain4j.formagent.infra.logging.RunLogger;
import io.github.hide212131.langchain4j.formagent.runtime.agent.ObservabilitySink;
import io.github.hide212131.langchain4j.formagent.runtime.agent.RunEvent;
import java.util.Objects;

/** Writes one structured log line per finished run. */
public final class LoggingObservabilitySink implements ObservabilitySink {

    private final RunLogger log;

    public LoggingObservabilitySink() {
        this(new RunLogger(LoggingObservabilitySink.class));
    }

    public LoggingObservabilitySink(RunLogger log) {
        this.log = Objects.requireNonNull(log, "log");
    }

    @Override
    public void record(RunEvent event) {
        Objects.requireNonNull(event, "event");
        String detail = "durationMs=" + event.durationMs() + " resourceId="
                + (event.resourceId() == null ? "-" : event.resourceId());
        if (event.succeeded()) {
            log.info(event.runId(), "observability", "agent.call", "agent call succeeded",
                    detail + " tokens=" + event.output().metadata().getOrDefault("tokens", "-"));
        } else {
            log.warn(event.runId(), "observability", "agent.call", "agent call failed; " + detail, event.error());
        }
    }
}
