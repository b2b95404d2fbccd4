package com.purchasingpower.cora.configuration;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pool for reindex passes. Files are indexed in parallel; writes to the same file path
 * are serialized by the coordinator, not by the pool.
 */
@Slf4j
@Configuration
public class AsyncConfig {

    @Bean(name = "indexingExecutor")
    public Executor indexingExecutor(AppProperties props) {
        IndexingProperties indexing = props.getIndexing();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(indexing.getCorePoolSize());
        executor.setMaxPoolSize(Math.max(indexing.getCorePoolSize(), indexing.getMaxPoolSize()));
        executor.setQueueCapacity(indexing.getQueueCapacity());
        executor.setThreadNamePrefix("reindex-");
        // a full rescan must never lose files to a saturated queue
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();

        log.info("✅ Indexing executor configured: core={}, max={}, queue={}",
                executor.getCorePoolSize(),
                executor.getMaxPoolSize(),
                indexing.getQueueCapacity());

        return executor;
    }
}
