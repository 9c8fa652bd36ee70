package com.example.pipelinesync.client.target;

import com.example.pipelinesync.client.ApiResponse;
import com.example.pipelinesync.client.BackoffPolicy;
import com.example.pipelinesync.config.AsyncConfig;
import com.example.pipelinesync.config.ResilienceConfig;
import com.example.pipelinesync.config.TargetApiProperties;
import com.example.pipelinesync.config.WebClientConfig;
import com.example.pipelinesync.exception.RateLimitExceededException;
import com.example.pipelinesync.exception.RemoteServiceException;
import com.example.pipelinesync.metrics.SyncMetrics;
import com.example.pipelinesync.support.StubHttpServer;
import com.example.pipelinesync.support.StubHttpServer.StubResponse;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.retry.Retry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Rate-limited client against an in-process stub: retry ceiling, Retry-After handling,
 * concurrency bound and aggregate rate.
 */
class TargetApiClientTest {

    private final StubHttpServer server = StubHttpServer.start();
    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    private ThreadPoolTaskExecutor executor;

    @AfterEach
    void tearDown() {
        if (executor != null) {
            executor.shutdown();
        }
        server.close();
    }

    /**
     * A Target call that always returns 500 is attempted exactly maxRetries + 1 times.
     */
    @Test
    void alwaysFailingCallIsAttemptedMaxRetriesPlusOneTimes() {
        TargetApiClient client = client(properties(5, 100));
        server.respond("PUT", "/opportunities/o1", StubResponse.json(500, "{}"));

        assertThatThrownBy(() -> client.updateOpportunity("o1", OpportunityUpdate.builder().name("x").build()))
                .isInstanceOf(RemoteServiceException.class)
                .satisfies(e -> assertThat(((RemoteServiceException) e).getStatus()).isEqualTo(500));

        assertThat(server.count("PUT", "/opportunities/o1")).isEqualTo(4);
        assertThat(meterRegistry.get("target_requests_total").tag("outcome", "5xx").counter().count())
                .isEqualTo(4.0);
    }

    @Test
    void rateLimitedThenSuccessfulReturnsSuccess() {
        TargetApiClient client = client(properties(5, 100));
        server.respond("GET", "/opportunities/o1",
                StubResponse.json(429, "{}").withHeader("Retry-After", "0"),
                StubResponse.json(200, "{\"opportunity\":{\"id\":\"o1\"}}"));

        ApiResponse response = client.getOpportunity("o1");

        assertThat(response.getStatus()).isEqualTo(200);
        assertThat(client.readBody(response).path("opportunity").path("id").asText()).isEqualTo("o1");
        assertThat(server.count("GET", "/opportunities/o1")).isEqualTo(2);
    }

    @Test
    void persistentRateLimitSurfacesAsRateLimitError() {
        TargetApiClient client = client(properties(5, 100));
        server.respond("GET", "/opportunities/o1", StubResponse.json(429, "{}"));

        assertThatThrownBy(() -> client.getOpportunity("o1")).isInstanceOf(RateLimitExceededException.class);
        assertThat(server.count("GET", "/opportunities/o1")).isEqualTo(4);
    }

    @Test
    void clientErrorIsReturnedWithoutRetry() {
        TargetApiClient client = client(properties(5, 100));
        server.respond("PUT", "/opportunities/o1", StubResponse.json(422, "{\"message\":\"bad stage\"}"));

        ApiResponse response = client.updateOpportunity("o1", OpportunityUpdate.builder().pipelineStageId("s").build());

        assertThat(response.getStatus()).isEqualTo(422);
        assertThat(response.getBody()).contains("bad stage");
        assertThat(server.count("PUT", "/opportunities/o1")).isEqualTo(1);
    }

    @Test
    void sendsAuthVersionAndJsonBody() {
        TargetApiClient client = client(properties(5, 100));
        server.respond("PUT", "/opportunities/o1", StubResponse.json(200, "{}"));

        client.updateOpportunity("o1", OpportunityUpdate.builder()
                .pipelineId("p1")
                .pipelineStageId("s2")
                .monetaryValue(new BigDecimal("1250.50"))
                .customField(new OpportunityUpdate.CustomFieldValue("field-job", "99"))
                .build());

        StubHttpServer.RecordedRequest request = server.requests("PUT", "/opportunities/o1").get(0);
        assertThat(request.header("authorization")).isEqualTo("Bearer api-key");
        assertThat(request.header(TargetApiClient.VERSION_HEADER)).isEqualTo("2021-07-28");
        assertThat(request.body())
                .contains("\"pipelineId\":\"p1\"")
                .contains("\"pipelineStageId\":\"s2\"")
                .contains("\"monetaryValue\":1250.50")
                .contains("\"field_value\":\"99\"")
                .doesNotContain("\"name\"");
    }

    @Test
    void searchSendsLocationPipelineAndPaging() {
        TargetApiClient client = client(properties(5, 100));
        server.respond("GET", "/opportunities/search", StubResponse.json(200, "{\"opportunities\":[]}"));

        client.searchOpportunities("pipe-1", 3);

        StubHttpServer.RecordedRequest request = server.requests("GET", "/opportunities/search").get(0);
        assertThat(request.queryParam("location_id")).isEqualTo("loc-1");
        assertThat(request.queryParam("pipeline_id")).isEqualTo("pipe-1");
        assertThat(request.queryParam("page")).isEqualTo("3");
        assertThat(request.queryParam("limit")).isEqualTo("100");
    }

    @Test
    void neverExceedsConfiguredConcurrency() {
        TargetApiClient client = client(properties(2, 100));
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger maxInFlight = new AtomicInteger();
        server.on("GET", "/opportunities/slow", request -> {
            maxInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
            sleep(150);
            inFlight.decrementAndGet();
            return StubResponse.json(200, "{}");
        });

        List<CompletableFuture<ApiResponse>> futures = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            futures.add(client.submit(TargetRequest.builder().method(HttpMethod.GET).path("/opportunities/slow").build()));
        }

        assertThat(futures).allSatisfy(future -> assertThat(future.join().getStatus()).isEqualTo(200));
        assertThat(maxInFlight.get()).isLessThanOrEqualTo(2);
        assertThat(server.count("GET", "/opportunities/slow")).isEqualTo(6);
    }

    @Test
    void aggregateRateIsBoundedWhateverTheConcurrency() {
        TargetApiClient client = client(properties(5, 2));
        server.respond("GET", "/opportunities/fast", StubResponse.json(200, "{}"));

        long started = System.nanoTime();
        List<CompletableFuture<ApiResponse>> futures = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            futures.add(client.submit(TargetRequest.builder().method(HttpMethod.GET).path("/opportunities/fast").build()));
        }
        futures.forEach(CompletableFuture::join);
        long elapsedMillis = Duration.ofNanos(System.nanoTime() - started).toMillis();

        // 6 requests at 2 per second span at least two refresh periods after the first
        assertThat(elapsedMillis).isGreaterThanOrEqualTo(1000);
        assertThat(server.count("GET", "/opportunities/fast")).isEqualTo(6);
    }

    private TargetApiProperties properties(int concurrency, int ratePerSecond) {
        TargetApiProperties properties = new TargetApiProperties();
        properties.setBaseUrl(server.baseUrl());
        properties.setApiKey("api-key");
        properties.setLocationId("loc-1");
        properties.setConcurrency(concurrency);
        properties.setRatePerSecond(ratePerSecond);
        properties.setPermitTimeout(Duration.ofSeconds(10));
        properties.setQueueCapacity(100);
        properties.setMaxRetries(3);
        properties.setMinBackoff(Duration.ofMillis(10));
        properties.setMaxBackoff(Duration.ofMillis(50));
        properties.setTimeout(Duration.ofSeconds(5));
        return properties;
    }

    private TargetApiClient client(TargetApiProperties properties) {
        executor = AsyncConfig.buildTargetRequestExecutor(properties);
        RateLimiter rateLimiter = RateLimiter.of("target-test", ResilienceConfig.rateLimiterConfig(properties));
        Retry retry = Retry.of("target-test", ResilienceConfig.retryConfig(properties.getMaxRetries(),
                new BackoffPolicy(properties.getMinBackoff(), properties.getMaxBackoff())));
        return new TargetApiClient(WebClientConfig.build(properties.getBaseUrl(), properties.getTimeout()),
                properties, executor, rateLimiter, retry, new SyncMetrics(meterRegistry), new ObjectMapper());
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
