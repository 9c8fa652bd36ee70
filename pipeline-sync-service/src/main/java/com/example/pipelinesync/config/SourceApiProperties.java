package com.example.pipelinesync.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Field-service (Source) API settings.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "source")
public class SourceApiProperties {

    @NotBlank
    private String baseUrl = "https://api.servicetitan.io";

    @NotBlank
    private String authUrl = "https://auth.servicetitan.io/connect/token";

    @NotBlank
    private String tenantId;

    @NotBlank
    private String clientId;

    @NotBlank
    private String clientSecret;

    /** Sent as ST-App-Key on every call. */
    @NotBlank
    private String appKey;

    private long tokenRefreshBufferSeconds = 60;

    @Min(1)
    private int pageSize = 100;

    /** Pause between pages, independent of the Target rate limit. */
    private Duration pageDelay = Duration.ofMillis(100);

    @Min(0)
    private int maxRetries = 3;

    private Duration retryDelay = Duration.ofSeconds(1);

    private Duration timeout = Duration.ofSeconds(30);
}
