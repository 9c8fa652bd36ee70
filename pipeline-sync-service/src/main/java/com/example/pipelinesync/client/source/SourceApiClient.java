package com.example.pipelinesync.client.source;

import com.example.pipelinesync.client.ApiResponse;
import com.example.pipelinesync.client.BackoffPolicy;
import com.example.pipelinesync.client.TransientErrors;
import com.example.pipelinesync.config.SourceApiProperties;
import com.example.pipelinesync.exception.AuthenticationException;
import com.example.pipelinesync.exception.RateLimitExceededException;
import com.example.pipelinesync.exception.RemoteServiceException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Client for the Source REST API.
 *
 * - Bearer token from {@link SourceTokenProvider} plus the application key header
 * - 429 / 5xx / timeouts retried with backoff, Retry-After honored
 * - A 401 invalidates the token and replays the call once
 * - Must be called outside transactions
 */
@Component
@Slf4j
public class SourceApiClient {

    static final String APP_KEY_HEADER = "ST-App-Key";

    private final WebClient sourceWebClient;
    private final SourceTokenProvider tokenProvider;
    private final SourceApiProperties properties;
    private final Retry sourceRetry;
    private final ObjectMapper objectMapper;

    public SourceApiClient(@Qualifier("sourceWebClient") WebClient sourceWebClient,
                           SourceTokenProvider tokenProvider,
                           SourceApiProperties properties,
                           @Qualifier("sourceRetry") Retry sourceRetry,
                           ObjectMapper objectMapper) {
        this.sourceWebClient = sourceWebClient;
        this.tokenProvider = tokenProvider;
        this.properties = properties;
        this.sourceRetry = sourceRetry;
        this.objectMapper = objectMapper;
    }

    /**
     * Fetch one page.
     *
     * @param pathTemplate path with a {@code {tenant}} placeholder, e.g. /jpm/v2/tenant/{tenant}/jobs
     * @param query        query parameters for this page
     * @throws AuthenticationException     token exchange failed, or the token was rejected twice
     * @throws RateLimitExceededException  429 persisted through every retry
     * @throws RemoteServiceException      5xx / transport failure persisted, or any other non-2xx status
     */
    public SourcePage fetchPage(String pathTemplate, Map<String, String> query) {
        String path = pathTemplate.replace("{tenant}", properties.getTenantId());

        ApiResponse response = getWithRetry(path, query);
        if (response.isUnauthorized()) {
            log.warn("Source rejected token (401), refreshing and replaying once: path={}", path);
            tokenProvider.invalidate();
            response = getWithRetry(path, query);
            if (response.isUnauthorized()) {
                throw new AuthenticationException("Source rejected a freshly issued token: path=" + path);
            }
        }

        if (response.isRateLimited()) {
            throw new RateLimitExceededException("Source rate limit persisted after retries: path=" + path);
        }
        if (!response.isSuccessful()) {
            throw new RemoteServiceException(String.format("Source returned status=%d for path=%s",
                    response.getStatus(), path), response.getStatus());
        }
        return parsePage(path, response.getBody());
    }

    private ApiResponse getWithRetry(String path, Map<String, String> query) {
        Supplier<ApiResponse> call = Retry.decorateSupplier(sourceRetry, () -> get(path, query));
        try {
            return call.get();
        } catch (RuntimeException e) {
            if (TransientErrors.isTransient(e)) {
                throw new RemoteServiceException("Source unreachable after retries: path=" + path + ": " + e.getMessage(), e);
            }
            throw e;
        }
    }

    private ApiResponse get(String path, Map<String, String> query) {
        String token = tokenProvider.getToken();
        ApiResponse response = sourceWebClient.get()
                .uri(uriBuilder -> {
                    uriBuilder.path(path);
                    query.forEach(uriBuilder::queryParam);
                    return uriBuilder.build();
                })
                .headers(headers -> {
                    headers.setBearerAuth(token);
                    headers.set(APP_KEY_HEADER, properties.getAppKey());
                })
                .accept(MediaType.APPLICATION_JSON)
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

        log.debug("Source GET path={} query={} status={}", path, query, response.getStatus());
        return response;
    }

    private SourcePage parsePage(String path, String body) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new RemoteServiceException("Source returned malformed JSON for path=" + path, e);
        }

        List<JsonNode> data = new ArrayList<>();
        root.path("data").forEach(data::add);
        JsonNode continueFrom = root.get("continueFrom");
        return SourcePage.builder()
                .data(data)
                .hasMore(root.path("hasMore").asBoolean(false))
                .continueFrom(continueFrom != null && !continueFrom.isNull() ? continueFrom.asText() : null)
                .build();
    }
}
