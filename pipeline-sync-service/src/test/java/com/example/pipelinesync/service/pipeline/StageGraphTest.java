package com.example.pipelinesync.service.pipeline;

import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StageGraphTest {

    private final StageGraph graph = new StageGraph("sales", "p1", "Sales", List.of(
            new StageGraph.Stage("a", "New", StageRole.NEW_LEAD),
            new StageGraph.Stage("b", "Proposal", StageRole.PROPOSAL_SENT),
            new StageGraph.Stage("c", "Follow-up", null),
            new StageGraph.Stage("d", "Sold", StageRole.JOB_SOLD)));

    @Test
    void ordersStagesByPosition() {
        assertThat(graph.isAtOrPast("d", StageRole.JOB_SOLD)).isTrue();
        assertThat(graph.isAtOrPast("c", StageRole.PROPOSAL_SENT)).isTrue();
        assertThat(graph.isAtOrPast("a", StageRole.PROPOSAL_SENT)).isFalse();
        assertThat(graph.isAtOrPast("unknown", StageRole.NEW_LEAD)).isFalse();
        assertThat(graph.isAtOrPast(null, StageRole.NEW_LEAD)).isFalse();
    }

    @Test
    void listsStagesAtOrBeforeRole() {
        assertThat(graph.stageIdsAtOrBefore(StageRole.PROPOSAL_SENT)).containsExactly("a", "b");
        assertThat(graph.stageIdsAtOrBefore(StageRole.JOB_SOLD)).containsExactly("a", "b", "c", "d");
    }

    @Test
    void resolvesRolesBothWays() {
        assertThat(graph.stage(StageRole.JOB_SOLD).id()).isEqualTo("d");
        assertThat(graph.roleOf("b")).contains(StageRole.PROPOSAL_SENT);
        assertThat(graph.roleOf("c")).isEmpty();
        assertThat(graph.stageIds(EnumSet.of(StageRole.JOB_SOLD, StageRole.NEW_LEAD, StageRole.COMPLETED)))
                .containsExactly("a", "d");
        assertThat(graph.contains("c")).isTrue();
        assertThat(graph.contains("z")).isFalse();
    }

    @Test
    void missingRoleIsAnError() {
        assertThat(graph.hasRole(StageRole.COMPLETED)).isFalse();
        assertThatThrownBy(() -> graph.stage(StageRole.COMPLETED)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void rejectsDuplicateStagesAndRoles() {
        assertThatThrownBy(() -> new StageGraph("x", "p", "X", List.of(
                new StageGraph.Stage("a", "A", StageRole.NEW_LEAD),
                new StageGraph.Stage("a", "B", StageRole.CONTACTED))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("twice");

        assertThatThrownBy(() -> new StageGraph("x", "p", "X", List.of(
                new StageGraph.Stage("a", "A", StageRole.NEW_LEAD),
                new StageGraph.Stage("b", "B", StageRole.NEW_LEAD))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("NEW_LEAD");
    }

    @Test
    void stagesAreImmutable() {
        assertThatThrownBy(() -> graph.getStages().add(new StageGraph.Stage("e", "E", null)))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
