package com.example.pipelinesync.client;

import io.github.resilience4j.core.IntervalBiFunction;
import io.github.resilience4j.core.functions.Either;

import java.time.Duration;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * Exponential backoff between a floor and a ceiling.
 * A server Retry-After hint replaces the computed delay but stays within the same bounds.
 */
public class BackoffPolicy implements IntervalBiFunction<ApiResponse> {

    private final Duration floor;
    private final Duration ceiling;

    public BackoffPolicy(Duration floor, Duration ceiling) {
        if (floor.isNegative() || ceiling.compareTo(floor) < 0) {
            throw new IllegalArgumentException("Backoff requires 0 <= floor <= ceiling, got " + floor + " / " + ceiling);
        }
        this.floor = floor;
        this.ceiling = ceiling;
    }

    /**
     * Delay before the attempt following {@code attempt} (1-based).
     */
    public Duration delayFor(int attempt, Duration retryAfter) {
        if (retryAfter != null) {
            return clamp(retryAfter);
        }
        int exponent = Math.min(Math.max(attempt - 1, 0), 20);
        return clamp(floor.multipliedBy(1L << exponent));
    }

    @Override
    public Long apply(Integer attempt, Either<Throwable, ApiResponse> outcome) {
        Duration hint = outcome != null && outcome.isRight() ? outcome.get().getRetryAfter() : null;
        return delayFor(attempt, hint).toMillis();
    }

    private Duration clamp(Duration delay) {
        if (delay.compareTo(floor) < 0) {
            return floor;
        }
        return delay.compareTo(ceiling) > 0 ? ceiling : delay;
    }

    /**
     * Parses delta-seconds or an HTTP-date relative to {@code now}.
     */
    public static Duration parseRetryAfter(String header, ZonedDateTime now) {
        if (header == null || header.isBlank()) {
            return null;
        }
        String value = header.trim();
        try {
            long seconds = Long.parseLong(value);
            return seconds < 0 ? null : Duration.ofSeconds(seconds);
        } catch (NumberFormatException notSeconds) {
            try {
                ZonedDateTime at = ZonedDateTime.parse(value, DateTimeFormatter.RFC_1123_DATE_TIME);
                Duration delta = Duration.between(now, at);
                return delta.isNegative() ? Duration.ZERO : delta;
            } catch (DateTimeParseException unparseable) {
                return null;
            }
        }
    }
}
