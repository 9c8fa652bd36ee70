package com.example.pipelinesync.config;

import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterRegistry;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import io.github.resilience4j.retry.event.RetryOnErrorEvent;
import io.github.resilience4j.retry.event.RetryOnRetryEvent;
import io.github.resilience4j.retry.event.RetryOnSuccessEvent;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Configuration;

/**
 * Logs retry and rate-limiter events for every registered instance.
 * Retry exhaustion is WARN, not ERROR: the client decides whether the final outcome is fatal.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class RetryEventConfig {

    private final RetryRegistry retryRegistry;
    private final RateLimiterRegistry rateLimiterRegistry;

    @PostConstruct
    public void configureEventLogging() {
        retryRegistry.getAllRetries().forEach(this::subscribe);
        retryRegistry.getEventPublisher().onEntryAdded(event -> subscribe(event.getAddedEntry()));

        rateLimiterRegistry.getAllRateLimiters().forEach(this::subscribe);
        rateLimiterRegistry.getEventPublisher().onEntryAdded(event -> subscribe(event.getAddedEntry()));
    }

    private void subscribe(Retry retry) {
        retry.getEventPublisher()
                .onRetry(this::logRetryAttempt)
                .onSuccess(this::logRetrySuccess)
                .onError(this::logRetryError);
        log.debug("Retry event logging enabled for: {}", retry.getName());
    }

    private void subscribe(RateLimiter rateLimiter) {
        rateLimiter.getEventPublisher()
                .onFailure(event -> log.warn("RATE_LIMIT_WAIT_EXCEEDED name={}", event.getRateLimiterName()));
    }

    private void logRetryAttempt(RetryOnRetryEvent event) {
        log.warn("RETRY_ATTEMPT name={} attempt={}/{} wait={}ms error={}",
                event.getName(),
                event.getNumberOfRetryAttempts(),
                maxAttempts(event.getName()),
                event.getWaitInterval().toMillis(),
                event.getLastThrowable() != null ? event.getLastThrowable().getClass().getSimpleName() : "retryable-status");
    }

    private String maxAttempts(String retryName) {
        return retryRegistry.find(retryName)
                .map(retry -> String.valueOf(retry.getRetryConfig().getMaxAttempts()))
                .orElse("?");
    }

    private void logRetrySuccess(RetryOnSuccessEvent event) {
        if (event.getNumberOfRetryAttempts() > 0) {
            log.info("RETRY_SUCCESS name={} attempts={}", event.getName(), event.getNumberOfRetryAttempts());
        }
    }

    private void logRetryError(RetryOnErrorEvent event) {
        log.warn("RETRY_EXHAUSTED name={} attempts={} error={}",
                event.getName(),
                event.getNumberOfRetryAttempts(),
                event.getLastThrowable() != null ? event.getLastThrowable().getClass().getSimpleName() : "unknown");
    }
}
