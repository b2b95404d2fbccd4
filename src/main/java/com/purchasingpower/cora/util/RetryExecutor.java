package com.purchasingpower.cora.util;

import com.purchasingpower.cora.configuration.GlobalRetryConfig;
import com.purchasingpower.cora.model.CallContext;
import com.purchasingpower.cora.model.ServiceType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Runs a call against an external collaborator with exponential backoff, logging every attempt
 * through a {@link CallContext}. When all attempts fail the last failure is rethrown.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RetryExecutor {

    private final GlobalRetryConfig retryConfig;

    public <T> T execute(ServiceType service, String operation, Supplier<T> action) {
        return execute(service, operation, null, action);
    }

    /**
     * @param target what the call is for, e.g. {@code repoId:filePath}; null when not tied to one
     */
    public <T> T execute(ServiceType service, String operation, String target, Supplier<T> action) {
        CallContext call = ExternalCallLogger.startCall(service, operation, target, log);
        int maxAttempts = Math.max(1, retryConfig.getMaxAttempts());
        RuntimeException lastFailure = null;

        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            try {
                call.logRequest("attempt " + (attempt + 1) + "/" + maxAttempts);
                T result = action.get();
                call.logResponse("ok");
                return result;
            } catch (RuntimeException e) {
                lastFailure = e;
                if (attempt + 1 >= maxAttempts) {
                    break;
                }
                long delayMs = retryConfig.delayForAttempt(attempt);
                call.logRetry(attempt + 1, delayMs, e);
                if (!sleep(delayMs)) {
                    break;
                }
            }
        }

        call.logError("giving up after " + maxAttempts + " attempts", lastFailure);
        throw lastFailure;
    }

    public void run(ServiceType service, String operation, Runnable action) {
        execute(service, operation, () -> {
            action.run();
            return null;
        });
    }

    private boolean sleep(long delayMs) {
        if (delayMs <= 0) {
            return true;
        }
        try {
            Thread.sleep(delayMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
