package com.example.pipelinesync.config;

import com.example.pipelinesync.metrics.SyncMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Executor backing the Target request queue.
 *
 * Core and max pool are both the configured concurrency, so at most that many
 * requests are in flight and the rest wait in FIFO order in the bounded queue.
 * A full queue rejects (AbortPolicy) instead of running the request on the caller.
 */
@Configuration
@Slf4j
public class AsyncConfig {

    @Bean(name = "targetRequestExecutor")
    public ThreadPoolTaskExecutor targetRequestExecutor(TargetApiProperties properties, SyncMetrics syncMetrics) {
        ThreadPoolTaskExecutor executor = buildTargetRequestExecutor(properties);
        syncMetrics.registerThreadPoolMetrics("targetRequestExecutor", executor.getThreadPoolExecutor());
        return executor;
    }

    public static ThreadPoolTaskExecutor buildTargetRequestExecutor(TargetApiProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getConcurrency());
        executor.setMaxPoolSize(properties.getConcurrency());
        executor.setQueueCapacity(properties.getQueueCapacity());
        executor.setThreadNamePrefix("target-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.setTaskDecorator(new MdcTaskDecorator());
        executor.initialize();

        log.info("Initialized targetRequestExecutor - concurrency={}, queue={}",
                properties.getConcurrency(), properties.getQueueCapacity());
        return executor;
    }
}
