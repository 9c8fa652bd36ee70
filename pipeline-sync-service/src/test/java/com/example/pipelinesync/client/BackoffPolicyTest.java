package com.example.pipelinesync.client;

import io.github.resilience4j.core.functions.Either;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BackoffPolicyTest {

    private final BackoffPolicy policy = new BackoffPolicy(Duration.ofSeconds(1), Duration.ofSeconds(10));

    @Test
    void delayDoublesFromFloorAndStopsAtCeiling() {
        assertThat(policy.delayFor(1, null)).isEqualTo(Duration.ofSeconds(1));
        assertThat(policy.delayFor(2, null)).isEqualTo(Duration.ofSeconds(2));
        assertThat(policy.delayFor(3, null)).isEqualTo(Duration.ofSeconds(4));
        assertThat(policy.delayFor(4, null)).isEqualTo(Duration.ofSeconds(8));
        assertThat(policy.delayFor(5, null)).isEqualTo(Duration.ofSeconds(10));
        assertThat(policy.delayFor(60, null)).isEqualTo(Duration.ofSeconds(10));
    }

    @Test
    void retryAfterHintReplacesComputedDelayWithinBounds() {
        assertThat(policy.delayFor(1, Duration.ofSeconds(3))).isEqualTo(Duration.ofSeconds(3));
        assertThat(policy.delayFor(1, Duration.ZERO)).isEqualTo(Duration.ofSeconds(1));
        assertThat(policy.delayFor(1, Duration.ofMinutes(5))).isEqualTo(Duration.ofSeconds(10));
    }

    @Test
    void applyUsesHintFromResponseAndComputesForExceptions() {
        ApiResponse throttled = ApiResponse.builder().status(429).retryAfter(Duration.ofSeconds(2)).build();

        assertThat(policy.apply(1, Either.right(throttled))).isEqualTo(2000L);
        assertThat(policy.apply(3, Either.left(new IOException("reset")))).isEqualTo(4000L);
    }

    @Test
    void parsesRetryAfterSecondsAndHttpDate() {
        ZonedDateTime now = ZonedDateTime.of(2026, 1, 1, 0, 0, 0, 0, ZoneOffset.UTC);

        assertThat(BackoffPolicy.parseRetryAfter("5", now)).isEqualTo(Duration.ofSeconds(5));
        assertThat(BackoffPolicy.parseRetryAfter("Thu, 01 Jan 2026 00:00:30 GMT", now)).isEqualTo(Duration.ofSeconds(30));
        assertThat(BackoffPolicy.parseRetryAfter("Wed, 31 Dec 2025 23:59:00 GMT", now)).isEqualTo(Duration.ZERO);
        assertThat(BackoffPolicy.parseRetryAfter("soon", now)).isNull();
        assertThat(BackoffPolicy.parseRetryAfter("-1", now)).isNull();
        assertThat(BackoffPolicy.parseRetryAfter(null, now)).isNull();
    }

    @Test
    void rejectsCeilingBelowFloor() {
        assertThatThrownBy(() -> new BackoffPolicy(Duration.ofSeconds(5), Duration.ofSeconds(1)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
