package com.example.pipelinesync.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Settings for the Source mirror fetchers and the orchestrator.
 */
@Data
@ConfigurationProperties(prefix = "mirror")
public class MirrorSyncProperties {

    /** Incremental window used when an entity has never been synced. */
    private Duration lookback = Duration.ofDays(30);

    /** Entities run by the scheduled orchestrator, in order. */
    private List<String> entities = new ArrayList<>(List.of(
            "customers", "business-units", "jobs", "estimates", "appointments"));

    /** Upper bound on a per-entity fetch lock. */
    private Duration lockAtMostFor = Duration.ofMinutes(55);
}
