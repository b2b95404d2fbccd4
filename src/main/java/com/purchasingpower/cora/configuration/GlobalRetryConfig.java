package com.purchasingpower.cora.configuration;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Retry configuration for transient failures of the index store and the embedding provider.
 *
 * <p>Properties are loaded from the {@code app.retry} namespace in application.yml:
 * <pre>
 * app:
 *   retry:
 *     max-attempts: 3
 *     backoff-ms: 500
 *     max-backoff-ms: 8000
 *     multiplier: 2.0
 * </pre>
 *
 * <p>For attempt N (starting at 0) the delay is
 * {@code min(backoff-ms * multiplier^N, max-backoff-ms)}.
 */
@ConfigurationProperties(prefix = "app.retry")
@Data
public class GlobalRetryConfig {

    /** Total attempts including the first one. */
    private int maxAttempts = 3;

    private long backoffMs = 500;

    private long maxBackoffMs = 8000;

    private double multiplier = 2.0;

    public long delayForAttempt(int attempt) {
        double delay = backoffMs * Math.pow(multiplier, attempt);
        return (long) Math.min(delay, maxBackoffMs);
    }
}
