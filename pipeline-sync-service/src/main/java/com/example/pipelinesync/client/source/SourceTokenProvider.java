package com.example.pipelinesync.client.source;

import com.example.pipelinesync.config.SourceApiProperties;
import com.example.pipelinesync.exception.AuthenticationException;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Caches the Source OAuth bearer token and refreshes it before expiry.
 *
 * Refresh is single-flight: callers arriving during an exchange wait on the lock
 * and then find the fresh token instead of starting their own exchange.
 */
@Component
@Slf4j
public class SourceTokenProvider {

    private static final long DEFAULT_EXPIRES_IN_SECONDS = 3600;

    private final WebClient authWebClient;
    private final SourceApiProperties properties;
    private final Clock clock;
    private final ReentrantLock refreshLock = new ReentrantLock();

    private volatile CachedToken cached;

    public SourceTokenProvider(@Qualifier("sourceAuthWebClient") WebClient authWebClient,
                               SourceApiProperties properties,
                               Clock clock) {
        this.authWebClient = authWebClient;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * @throws AuthenticationException when the exchange fails; not retried here
     */
    public String getToken() {
        CachedToken current = cached;
        if (isUsable(current)) {
            return current.accessToken();
        }

        refreshLock.lock();
        try {
            current = cached;
            if (isUsable(current)) {
                return current.accessToken();
            }
            cached = exchange();
            return cached.accessToken();
        } finally {
            refreshLock.unlock();
        }
    }

    /**
     * Drops the cached token, e.g. after Source rejected it with 401.
     */
    public void invalidate() {
        cached = null;
        log.info("Source token invalidated");
    }

    public TokenStatus status() {
        CachedToken current = cached;
        return TokenStatus.builder()
                .cached(current != null)
                .valid(isUsable(current))
                .expiresAt(current != null ? current.expiresAt() : null)
                .build();
    }

    private boolean isUsable(CachedToken token) {
        if (token == null) {
            return false;
        }
        Instant refreshAt = token.expiresAt().minusSeconds(properties.getTokenRefreshBufferSeconds());
        return clock.instant().isBefore(refreshAt);
    }

    private CachedToken exchange() {
        log.debug("Exchanging client credentials for Source token: tenant={}", properties.getTenantId());
        JsonNode body;
        try {
            body = authWebClient.post()
                    .uri(properties.getAuthUrl())
                    .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                    .accept(MediaType.APPLICATION_JSON)
                    .header("x-tenant-id", properties.getTenantId())
                    .body(BodyInserters.fromFormData("grant_type", "client_credentials")
                            .with("client_id", properties.getClientId())
                            .with("client_secret", properties.getClientSecret()))
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, response -> response.bodyToMono(String.class)
                            .defaultIfEmpty("")
                            .flatMap(text -> Mono.error(new AuthenticationException(String.format(
                                    "Source token exchange rejected: status=%d body=%s",
                                    response.statusCode().value(), text)))))
                    .bodyToMono(JsonNode.class)
                    .block();
        } catch (AuthenticationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new AuthenticationException("Source token exchange failed: " + e.getMessage(), e);
        }

        if (body == null || !body.hasNonNull("access_token")) {
            throw new AuthenticationException("Source token response carried no access_token");
        }
        long expiresIn = body.path("expires_in").asLong(DEFAULT_EXPIRES_IN_SECONDS);
        Instant expiresAt = clock.instant().plus(Duration.ofSeconds(expiresIn));
        log.info("Obtained Source token: expiresAt={}", expiresAt);
        return new CachedToken(body.get("access_token").asText(), expiresAt);
    }

    private record CachedToken(String accessToken, Instant expiresAt) {
    }

    @Getter
    @Builder
    public static class TokenStatus {
        private final boolean cached;
        private final boolean valid;
        private final Instant expiresAt;
    }
}
