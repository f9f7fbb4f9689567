package io.github.hide212131.langchain4j.formagent.infra.logging;

import java.util.Locale;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Thin wrapper around SLF4J that renders one structured line per event:
 * {@code [phase=..][run=..][step=..] message detail=..}.
 */
public final class RunLogger {

    private final Logger logger;

    public RunLogger(Class<?> owner) {
        this(LoggerFactory.getLogger(Objects.requireNonNull(owner, "owner")));
    }

    public RunLogger(Logger logger) {
        this.logger = Objects.requireNonNull(logger, "logger");
    }

    public void info(String runId, String phase, String step, String message, String detail) {
        if (!logger.isInfoEnabled()) {
            return;
        }
        logger.info(format(runId, phase, step, message, detail, null));
    }

    public void debug(String runId, String phase, String step, String message, String detail) {
        if (!logger.isDebugEnabled()) {
            return;
        }
        logger.debug(format(runId, phase, step, message, detail, null));
    }

    public void warn(String runId, String phase, String step, String message, Throwable error) {
        if (!logger.isWarnEnabled()) {
            return;
        }
        logger.warn(format(runId, phase, step, message, null, error), error);
    }

    public void error(String runId, String phase, String step, String message, Throwable error) {
        if (!logger.isErrorEnabled()) {
            return;
        }
        logger.error(format(runId, phase, step, message, null, error), error);
    }

    static String format(String runId, String phase, String step, String message, String detail,
            Throwable error) {
        StringBuilder sb = new StringBuilder(128);
        sb.append(String.format(Locale.ROOT, "[phase=%s][run=%s][step=%s] %s", valueOrDash(phase),
                valueOrDash(runId), valueOrDash(step), message == null ? "" : message));
        if (detail != null && !detail.isBlank()) {
            sb.append(" detail=").append(detail.trim());
        }
        if (error != null) {
            sb.append(" error=").append(error.getClass().getSimpleName()).append(": ").append(error.getMessage());
        }
        return sb.toString();
    }

    private static String valueOrDash(String value) {
        if (value == null || value.isBlank()) {
            return "-";
        }
        return value.trim();
    }
}
