package com.example.pipelinesync.config;

import com.example.pipelinesync.client.ApiResponse;
import com.example.pipelinesync.client.BackoffPolicy;
import com.example.pipelinesync.client.TransientErrors;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.ratelimiter.RateLimiterRegistry;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Resilience4j instances for outbound calls.
 *
 * Retry strategy (both systems):
 * - Retry on 429, 5xx, timeouts and connection failures
 * - maxAttempts = maxRetries + 1
 * - Exponential backoff between a floor and a ceiling, Retry-After honored
 * - Exhaustion returns the last response so the client can classify it
 *
 * Rate limiter (Target only): one permit per attempt, refreshed every second.
 */
@Configuration
public class ResilienceConfig {

    public static final String TARGET = "target";
    public static final String SOURCE = "source";

    @Bean
    public RetryRegistry retryRegistry() {
        return RetryRegistry.ofDefaults();
    }

    @Bean
    public RateLimiterRegistry rateLimiterRegistry() {
        return RateLimiterRegistry.ofDefaults();
    }

    @Bean("targetRetry")
    public Retry targetRetry(RetryRegistry registry, TargetApiProperties properties) {
        return registry.retry(TARGET, retryConfig(properties.getMaxRetries(),
                new BackoffPolicy(properties.getMinBackoff(), properties.getMaxBackoff())));
    }

    @Bean("sourceRetry")
    public Retry sourceRetry(RetryRegistry registry, SourceApiProperties properties) {
        Duration floor = properties.getRetryDelay();
        return registry.retry(SOURCE, retryConfig(properties.getMaxRetries(),
                new BackoffPolicy(floor, floor.multipliedBy(10))));
    }

    @Bean("targetRateLimiter")
    public RateLimiter targetRateLimiter(RateLimiterRegistry registry, TargetApiProperties properties) {
        return registry.rateLimiter(TARGET, rateLimiterConfig(properties));
    }

    public static RetryConfig retryConfig(int maxRetries, BackoffPolicy backoffPolicy) {
        return RetryConfig.<ApiResponse>custom()
                .maxAttempts(maxRetries + 1)
                .retryOnResult(ApiResponse::isRetryable)
                .retryOnException(TransientErrors::isTransient)
                .intervalBiFunction(backoffPolicy)
                .failAfterMaxAttempts(false)
                .build();
    }

    public static RateLimiterConfig rateLimiterConfig(TargetApiProperties properties) {
        return RateLimiterConfig.custom()
                .limitForPeriod(properties.getRatePerSecond())
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .timeoutDuration(properties.getPermitTimeout())
                .build();
    }
}
