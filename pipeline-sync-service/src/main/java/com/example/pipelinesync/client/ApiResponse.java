package com.example.pipelinesync.client;

import lombok.Builder;
import lombok.Getter;

import java.time.Duration;

/**
 * Status, raw body and retry hint of one HTTP exchange.
 */
@Getter
@Builder
public class ApiResponse {

    private final int status;

    private final String body;

    /** Parsed Retry-After header, {@code null} when absent or unparseable. */
    private final Duration retryAfter;

    public boolean isSuccessful() {
        return status >= 200 && status < 300;
    }

    public boolean isRateLimited() {
        return status == 429;
    }

    public boolean isServerError() {
        return status >= 500;
    }

    public boolean isRetryable() {
        return isRateLimited() || isServerError();
    }

    public boolean isNotFound() {
        return status == 404;
    }

    public boolean isUnauthorized() {
        return status == 401;
    }
}
