package com.example.pipelinesync.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * CRM (Target) API settings, including the request envelope every mutation runs inside.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "target")
public class TargetApiProperties {

    @NotBlank
    private String baseUrl = "https://services.leadconnectorhq.com";

    @NotBlank
    private String apiKey;

    @NotBlank
    private String apiVersion = "2021-07-28";

    @NotBlank
    private String locationId;

    /** Requests executing at once. */
    @Min(1)
    private int concurrency = 5;

    /** Requests started per second across all callers. */
    @Min(1)
    private int ratePerSecond = 8;

    /** Longest a queued request waits for a rate permit. */
    private Duration permitTimeout = Duration.ofSeconds(60);

    @Min(1)
    private int queueCapacity = 1000;

    @Min(0)
    private int maxRetries = 3;

    private Duration minBackoff = Duration.ofSeconds(1);

    private Duration maxBackoff = Duration.ofSeconds(10);

    private Duration timeout = Duration.ofSeconds(30);

    private int searchPageSize = 100;

    private CustomFields customFields = new CustomFields();

    @Data
    public static class CustomFields {
        /** Custom field holding the linked Source customer id. */
        private String sourceCustomerId;
        /** Custom field holding the linked Source job id. */
        private String sourceJobId;
    }
}
