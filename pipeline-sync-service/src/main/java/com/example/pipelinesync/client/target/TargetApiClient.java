package com.example.pipelinesync.client.target;

import com.example.pipelinesync.client.ApiResponse;
import com.example.pipelinesync.client.BackoffPolicy;
import com.example.pipelinesync.client.TransientErrors;
import com.example.pipelinesync.config.TargetApiProperties;
import com.example.pipelinesync.exception.RateLimitExceededException;
import com.example.pipelinesync.exception.RemoteServiceException;
import com.example.pipelinesync.metrics.SyncMetrics;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Rate-limited, retrying client used for every Target call.
 *
 * CRITICAL DESIGN:
 * - Requests are admitted FIFO into a bounded executor whose pool size is the concurrency limit
 * - Every attempt (retries included) takes a rate-limiter permit, so the aggregate rate never
 *   exceeds the configured ops/sec whatever the caller concurrency
 * - 429 / 5xx / timeouts are retried with backoff; other 4xx are returned unmodified
 * - Exhausted 429 surfaces as {@link RateLimitExceededException}, exhausted 5xx or transport
 *   failure as {@link RemoteServiceException}
 */
@Component
@Slf4j
public class TargetApiClient {

    static final String VERSION_HEADER = "Version";

    private final WebClient targetWebClient;
    private final TargetApiProperties properties;
    private final Executor requestExecutor;
    private final RateLimiter rateLimiter;
    private final Retry retry;
    private final SyncMetrics syncMetrics;
    private final ObjectMapper objectMapper;

    public TargetApiClient(@Qualifier("targetWebClient") WebClient targetWebClient,
                           TargetApiProperties properties,
                           @Qualifier("targetRequestExecutor") Executor requestExecutor,
                           @Qualifier("targetRateLimiter") RateLimiter rateLimiter,
                           @Qualifier("targetRetry") Retry retry,
                           SyncMetrics syncMetrics,
                           ObjectMapper objectMapper) {
        this.targetWebClient = targetWebClient;
        this.properties = properties;
        this.requestExecutor = requestExecutor;
        this.rateLimiter = rateLimiter;
        this.retry = retry;
        this.syncMetrics = syncMetrics;
        this.objectMapper = objectMapper;
    }

    /**
     * Queue the request and wait for its final outcome.
     */
    public ApiResponse execute(TargetRequest request) {
        try {
            return submit(request).join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }

    /**
     * Queue the request. Completion order across submitted requests is not guaranteed.
     *
     * @throws java.util.concurrent.RejectedExecutionException when the queue is full
     */
    public CompletableFuture<ApiResponse> submit(TargetRequest request) {
        return CompletableFuture.supplyAsync(() -> executeWithRetry(request), requestExecutor);
    }

    public ApiResponse getOpportunity(String targetId) {
        return execute(TargetRequest.builder()
                .method(HttpMethod.GET)
                .path("/opportunities/" + targetId)
                .build());
    }

    public ApiResponse updateOpportunity(String targetId, OpportunityUpdate update) {
        return execute(TargetRequest.builder()
                .method(HttpMethod.PUT)
                .path("/opportunities/" + targetId)
                .body(update)
                .build());
    }

    /**
     * @param page 1-based page of the pipeline's opportunities
     */
    public ApiResponse searchOpportunities(String pipelineId, int page) {
        return execute(TargetRequest.builder()
                .method(HttpMethod.GET)
                .path("/opportunities/search")
                .queryParam("location_id", properties.getLocationId())
                .queryParam("pipeline_id", pipelineId)
                .queryParam("page", String.valueOf(page))
                .queryParam("limit", String.valueOf(properties.getSearchPageSize()))
                .build());
    }

    public JsonNode readBody(ApiResponse response) {
        try {
            return objectMapper.readTree(response.getBody() == null ? "" : response.getBody());
        } catch (JsonProcessingException e) {
            throw new RemoteServiceException("Target returned malformed JSON (status=" + response.getStatus() + ")", e);
        }
    }

    private ApiResponse executeWithRetry(TargetRequest request) {
        AtomicInteger attempt = new AtomicInteger();
        Supplier<ApiResponse> limited = RateLimiter.decorateSupplier(rateLimiter,
                () -> send(request, attempt.incrementAndGet()));
        Supplier<ApiResponse> retried = Retry.decorateSupplier(retry, limited);

        ApiResponse response;
        try {
            response = retried.get();
        } catch (RequestNotPermitted e) {
            throw new RateLimitExceededException(String.format(
                    "No Target rate permit within %s for %s", properties.getPermitTimeout(), request));
        } catch (RuntimeException e) {
            if (TransientErrors.isTransient(e)) {
                throw new RemoteServiceException(String.format("Target unreachable after %d attempts: %s: %s",
                        attempt.get(), request, e.getMessage()), e);
            }
            throw e;
        }

        if (response.isRateLimited()) {
            throw new RateLimitExceededException(String.format(
                    "Target rate limit persisted after %d attempts: %s", attempt.get(), request));
        }
        if (response.isServerError()) {
            throw new RemoteServiceException(String.format("Target returned status=%d after %d attempts: %s",
                    response.getStatus(), attempt.get(), request), response.getStatus());
        }
        return response;
    }

    private ApiResponse send(TargetRequest request, int attempt) {
        String method = request.getMethod().name();
        try {
            WebClient.RequestBodySpec spec = targetWebClient.method(request.getMethod())
                    .uri(uriBuilder -> {
                        uriBuilder.path(request.getPath());
                        request.getQueryParams().forEach(uriBuilder::queryParam);
                        return uriBuilder.build();
                    })
                    .headers(headers -> {
                        headers.setBearerAuth(properties.getApiKey());
                        headers.set(VERSION_HEADER, properties.getApiVersion());
                    })
                    .accept(MediaType.APPLICATION_JSON);
            WebClient.RequestHeadersSpec<?> ready = request.getBody() != null
                    ? spec.contentType(MediaType.APPLICATION_JSON).bodyValue(request.getBody())
                    : spec;

            ApiResponse response = ready
                    .exchangeToMono(clientResponse -> clientResponse.bodyToMono(String.class)
                            .defaultIfEmpty("")
                            .map(body -> ApiResponse.builder()
                                    .status(clientResponse.statusCode().value())
                                    .body(body)
                                    .retryAfter(BackoffPolicy.parseRetryAfter(
                                            clientResponse.headers().asHttpHeaders().getFirst(HttpHeaders.RETRY_AFTER),
                                            ZonedDateTime.now(ZoneOffset.UTC)))
                                    .build()))
                    .timeout(properties.getTimeout())
                    .block();

            log.info("Target request method={} path={} status={} attempt={}",
                    method, request.getPath(), response.getStatus(), attempt);
            syncMetrics.recordTargetRequest(method, response.getStatus());
            return response;
        } catch (RuntimeException e) {
            log.warn("Target request method={} path={} status=none attempt={} error={}",
                    method, request.getPath(), attempt, e.getMessage());
            syncMetrics.recordTargetRequest(method, 0);
            throw e;
        }
    }
}
