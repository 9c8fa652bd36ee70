package com.example.pipelinesync.service.pipeline;

import com.example.pipelinesync.config.PipelineProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Stage graphs built from configuration.
 *
 * Validated at startup: unknown role names, duplicate stages or roles, and roles the
 * transitions rely on but the pipeline lacks all fail the application context.
 */
@Component
@Slf4j
public class PipelineCatalog {

    private final Map<String, StageGraph> graphsByKey = new LinkedHashMap<>();
    private final Map<String, StageGraph> graphsByPipelineId = new LinkedHashMap<>();
    private final StageGraph sales;
    private final StageGraph install;

    public PipelineCatalog(PipelineProperties properties) {
        properties.getGraphs().forEach((key, pipeline) -> {
            StageGraph graph = toGraph(key, pipeline);
            graphsByKey.put(key, graph);
            if (graphsByPipelineId.put(graph.getPipelineId(), graph) != null) {
                throw new IllegalStateException("Pipeline id " + graph.getPipelineId() + " is configured twice");
            }
        });

        this.sales = require(properties.getTransitions().getSalesPipeline(),
                StageRole.PROPOSAL_SENT, StageRole.JOB_SOLD);
        this.install = require(properties.getTransitions().getInstallPipeline(),
                StageRole.JOB_CREATED, StageRole.IN_PROGRESS);
        requireOrder(sales, StageRole.PROPOSAL_SENT, StageRole.JOB_SOLD);
        requireOrder(install, StageRole.JOB_CREATED, StageRole.IN_PROGRESS);

        log.info("Loaded pipelines: {}", graphsByKey.keySet());
    }

    public StageGraph sales() {
        return sales;
    }

    public StageGraph install() {
        return install;
    }

    public Optional<StageGraph> byPipelineId(String pipelineId) {
        return Optional.ofNullable(graphsByPipelineId.get(pipelineId));
    }

    public Collection<StageGraph> all() {
        return graphsByKey.values();
    }

    private StageGraph require(String key, StageRole... roles) {
        StageGraph graph = graphsByKey.get(key);
        if (graph == null) {
            throw new IllegalStateException("Pipeline '" + key + "' is not configured under pipelines.graphs");
        }
        for (StageRole role : roles) {
            if (!graph.hasRole(role)) {
                throw new IllegalStateException("Pipeline '" + key + "' must define a stage with role " + role);
            }
        }
        return graph;
    }

    private static void requireOrder(StageGraph graph, StageRole earlier, StageRole later) {
        if (graph.isAtOrPast(graph.stage(earlier).id(), later)) {
            throw new IllegalStateException(String.format("Pipeline '%s' must order %s before %s",
                    graph.getKey(), earlier, later));
        }
    }

    private static StageGraph toGraph(String key, PipelineProperties.Pipeline pipeline) {
        List<StageGraph.Stage> stages = new ArrayList<>();
        for (PipelineProperties.Stage stage : pipeline.getStages()) {
            stages.add(new StageGraph.Stage(stage.getId(), stage.getName(), parseRole(key, stage.getRole())));
        }
        try {
            return new StageGraph(key, pipeline.getId(), pipeline.getName(), stages);
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Invalid pipeline configuration: " + e.getMessage(), e);
        }
    }

    private static StageRole parseRole(String key, String role) {
        if (role == null || role.isBlank()) {
            return null;
        }
        try {
            return StageRole.valueOf(role.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Pipeline '" + key + "' uses unknown stage role '" + role + "'", e);
        }
    }
}
