package com.purchasingpower.cora.model;

import org.slf4j.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Tracks one call to an external collaborator (index store, embedding model, git).
 *
 * Every call gets a short id so that request, retry and response lines of the
 * same call can be correlated in the log, together with the elapsed time. The target, when set,
 * names what the call is for, e.g. {@code repoId:filePath}.
 *
 * @see com.purchasingpower.cora.util.ExternalCallLogger
 * @see ServiceType
 */
public class CallContext {
    private final String callId;
    private final ServiceType service;
    private final String operation;
    private final String target;
    private final Instant startTime;
    private final Logger logger;

    public CallContext(ServiceType service, String operation, String target, Logger logger) {
        this.callId = UUID.randomUUID().toString().substring(0, 8);
        this.service = service;
        this.operation = operation;
        this.target = target;
        this.startTime = Instant.now();
        this.logger = logger;
    }

    public void logRequest(String summary, Object... details) {
        logger.debug("{} {} → {}{} [{}] {}", service.getEmoji(), service.getName(), operation, on(), callId,
                summary != null ? summary : "");
        logDetails(details);
    }

    public void logResponse(String summary, Object... details) {
        logger.debug("{} {} ← {}{} [{}] ({}ms) {}", service.getEmoji(), service.getName(), operation, on(),
                callId, getElapsedMs(), summary != null ? summary : "");
        logDetails(details);
    }

    public void logRetry(int attempt, long delayMs, Throwable cause) {
        logger.warn("{} {} ↻ {}{} [{}] attempt {} failed, retrying in {}ms - {}", service.getEmoji(),
                service.getName(), operation, on(), callId, attempt, delayMs, cause.getMessage());
    }

    public void logError(String errorMessage, Throwable ex) {
        logger.error("{} {} ✖ {}{} [{}] ({}ms) - {}", service.getEmoji(), service.getName(), operation, on(),
                callId, getElapsedMs(), errorMessage);
        if (ex != null) {
            logger.debug("  Error details:", ex);
        }
    }

    private String on() {
        return target == null ? "" : " on " + target;
    }

    private void logDetails(Object... details) {
        if (details == null) {
            return;
        }
        for (int i = 0; i + 1 < details.length; i += 2) {
            logger.trace("  {}: {}", details[i], details[i + 1]);
        }
    }

    public String getCallId() {
        return callId;
    }

    public ServiceType getService() {
        return service;
    }

    public String getOperation() {
        return operation;
    }

    public String getTarget() {
        return target;
    }

    public long getElapsedMs() {
        return Duration.between(startTime, Instant.now()).toMillis();
    }
}
