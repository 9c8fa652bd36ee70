package com.example.pipelinesync.config;

import com.example.pipelinesync.service.pipeline.InstallJobPriority;
import com.example.pipelinesync.service.pipeline.EstimatePriority;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pipeline stage graphs and transition tuning.
 * Stage order in configuration is pipeline order.
 */
@Data
@ConfigurationProperties(prefix = "pipelines")
public class PipelineProperties {

    /** Keyed by pipeline key, e.g. "sales", "install". */
    private Map<String, Pipeline> graphs = new LinkedHashMap<>();

    private Transitions transitions = new Transitions();

    @Data
    public static class Pipeline {
        private String id;
        private String name;
        private List<Stage> stages = new ArrayList<>();
    }

    @Data
    public static class Stage {
        private String id;
        private String name;
        /** Semantic role, blank for stages no transition refers to. */
        private String role;
    }

    @Data
    public static class Transitions {

        private String salesPipeline = "sales";

        private String installPipeline = "install";

        /** Business unit name fragments that mark a job as an install. */
        private List<String> installBusinessUnits = new ArrayList<>(List.of("Install"));

        /** How far back a newly created install job is still considered new. */
        private Duration installJobWindow = Duration.ofDays(7);

        private List<String> activeAppointmentStatuses = new ArrayList<>(List.of("Dispatched", "Working"));

        /** Tie-break order when a customer has several sold estimates. */
        private List<EstimatePriority> estimatePriority = new ArrayList<>(List.of(
                EstimatePriority.MOST_RECENTLY_SOLD, EstimatePriority.HIGHEST_TOTAL));

        /** Tie-break order when a customer has several new install jobs. */
        private List<InstallJobPriority> installJobPriority = new ArrayList<>(List.of(
                InstallJobPriority.NEWEST_CREATED));

        /** Read the opportunity from Target before mutating it. */
        private boolean verifyRemoteStage = true;

        /** Candidates applied per transition type per run. */
        private int batchLimit = 200;
    }
}
