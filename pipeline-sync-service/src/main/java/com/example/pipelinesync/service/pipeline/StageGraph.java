package com.example.pipelinesync.service.pipeline;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Ordered stages of one Target pipeline. Immutable once built.
 *
 * Position in the list is pipeline order: "at or past" a role means a stage index
 * greater than or equal to that role's index.
 */
@Getter
public class StageGraph {

    private final String key;
    private final String pipelineId;
    private final String name;
    private final List<Stage> stages;

    private final Map<String, Integer> indexById = new HashMap<>();
    private final Map<StageRole, Stage> stageByRole = new EnumMap<>(StageRole.class);

    public StageGraph(String key, String pipelineId, String name, List<Stage> stages) {
        if (pipelineId == null || pipelineId.isBlank()) {
            throw new IllegalArgumentException("Pipeline '" + key + "' has no id");
        }
        if (stages == null || stages.isEmpty()) {
            throw new IllegalArgumentException("Pipeline '" + key + "' has no stages");
        }
        this.key = key;
        this.pipelineId = pipelineId;
        this.name = name;
        this.stages = List.copyOf(stages);

        for (int i = 0; i < this.stages.size(); i++) {
            Stage stage = this.stages.get(i);
            if (stage.id() == null || stage.id().isBlank()) {
                throw new IllegalArgumentException("Pipeline '" + key + "' has a stage without id at position " + i);
            }
            if (indexById.putIfAbsent(stage.id(), i) != null) {
                throw new IllegalArgumentException("Pipeline '" + key + "' lists stage " + stage.id() + " twice");
            }
            if (stage.role() != null && stageByRole.putIfAbsent(stage.role(), stage) != null) {
                throw new IllegalArgumentException("Pipeline '" + key + "' assigns role " + stage.role() + " twice");
            }
        }
    }

    public boolean contains(String stageId) {
        return stageId != null && indexById.containsKey(stageId);
    }

    public boolean hasRole(StageRole role) {
        return stageByRole.containsKey(role);
    }

    public Stage stage(StageRole role) {
        Stage stage = stageByRole.get(role);
        if (stage == null) {
            throw new IllegalStateException("Pipeline '" + key + "' has no stage with role " + role);
        }
        return stage;
    }

    public Optional<StageRole> roleOf(String stageId) {
        Integer index = stageId == null ? null : indexById.get(stageId);
        return index == null ? Optional.empty() : Optional.ofNullable(stages.get(index).role());
    }

    /**
     * Unknown stage ids are never "at or past" anything.
     */
    public boolean isAtOrPast(String stageId, StageRole role) {
        Integer index = stageId == null ? null : indexById.get(stageId);
        return index != null && index >= indexById.get(stage(role).id());
    }

    public List<String> stageIdsAtOrBefore(StageRole role) {
        int limit = indexById.get(stage(role).id());
        List<String> ids = new ArrayList<>();
        for (int i = 0; i <= limit; i++) {
            ids.add(stages.get(i).id());
        }
        return ids;
    }

    /**
     * Stage ids for the roles this pipeline defines; roles it lacks are skipped.
     */
    public List<String> stageIds(Collection<StageRole> roles) {
        List<String> ids = new ArrayList<>();
        for (Stage stage : stages) {
            if (stage.role() != null && roles.contains(stage.role())) {
                ids.add(stage.id());
            }
        }
        return ids;
    }

    public record Stage(String id, String name, StageRole role) {
    }
}
