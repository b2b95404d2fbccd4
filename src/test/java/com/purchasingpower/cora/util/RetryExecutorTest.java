package com.purchasingpower.cora.util;

import com.purchasingpower.cora.configuration.GlobalRetryConfig;
import com.purchasingpower.cora.model.CallContext;
import com.purchasingpower.cora.model.ServiceType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Retry Executor Tests")
class RetryExecutorTest {

    private RetryExecutor retryExecutor;

    @BeforeEach
    void setUp() {
        GlobalRetryConfig config = new GlobalRetryConfig();
        config.setMaxAttempts(3);
        config.setBackoffMs(0);
        config.setMaxBackoffMs(0);
        retryExecutor = new RetryExecutor(config);
    }

    @Test
    @DisplayName("A call for a file is retried until it succeeds")
    void testExecute_RetriesUntilSuccess() {
        // Given
        AtomicInteger attempts = new AtomicInteger();

        // When
        String result = retryExecutor.execute(ServiceType.INDEX_STORE, "upsertChunk",
                ExternalCallLogger.fileTarget("demo", "src/a.ts"), () -> {
                    if (attempts.incrementAndGet() < 3) {
                        throw new IllegalStateException("connection reset");
                    }
                    return "stored";
                });

        // Then
        assertEquals("stored", result);
        assertEquals(3, attempts.get());
    }

    @Test
    @DisplayName("The last failure is rethrown once every attempt failed")
    void testExecute_GivesUp() {
        AtomicInteger attempts = new AtomicInteger();

        IllegalStateException thrown = assertThrows(IllegalStateException.class,
                () -> retryExecutor.execute(ServiceType.EMBEDDING, "embedChunks", "demo:src/a.ts", () -> {
                    throw new IllegalStateException("attempt " + attempts.incrementAndGet());
                }));

        assertEquals("attempt 3", thrown.getMessage());
    }

    @Test
    @DisplayName("Call targets name the repository, file and line range")
    void testTargets() {
        assertEquals("demo:src/a.ts", ExternalCallLogger.fileTarget("demo", "src/a.ts"));
        assertEquals("demo", ExternalCallLogger.fileTarget("demo", ""));
        assertEquals("src/a.ts#L3-9", ExternalCallLogger.linesTarget("src/a.ts", 3, 9));

        CallContext call = ExternalCallLogger.startCall(ServiceType.INDEX_STORE, "publishFileVersion",
                "demo:src/a.ts", LoggerFactory.getLogger(RetryExecutorTest.class));
        assertEquals("demo:src/a.ts", call.getTarget());
        assertNull(ExternalCallLogger.startCall(ServiceType.GIT, "DiffCommits",
                LoggerFactory.getLogger(RetryExecutorTest.class)).getTarget());
    }

    @Test
    @DisplayName("Long text is cut for the log with the number of dropped chars")
    void testTruncate() {
        assertEquals("abc... [+3 chars]", ExternalCallLogger.truncate("abcdef", 3));
        assertEquals("abc", ExternalCallLogger.truncate("abc", 3));
        assertEquals("(null)", ExternalCallLogger.truncate(null, 3));
    }
}
