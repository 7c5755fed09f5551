package io.conclave.core.workflow;

import static org.assertj.core.api.Assertions.assertThat;

import io.conclave.core.workflow.node.DecisionNode;
import io.conclave.core.workflow.node.ProcessNode;
import java.util.List;
import org.junit.jupiter.api.Test;

class WorkflowGraphValidatorTest {

    private final WorkflowGraphValidator validator = new WorkflowGraphValidator();

    @Test
    void shouldAcceptBranchingGraph() {
        // Given
        WorkflowDefinition definition =
                new WorkflowDefinition(
                        "review",
                        "start",
                        List.of(
                                ProcessNode.of("start", "Start"),
                                new DecisionNode("gate", "Approve?"),
                                ProcessNode.of("merge", "Merge"),
                                ProcessNode.of("reject", "Reject")),
                        List.of(
                                GraphEdge.of("start", "gate"),
                                GraphEdge.of("gate", "merge"),
                                GraphEdge.of("gate", "reject")));

        // When
        WorkflowGraphValidator.Report report = validator.validate(definition);

        // Then
        assertThat(report.isValid()).isTrue();
        assertThat(report.warnings()).isEmpty();
    }

    @Test
    void shouldReportMissingInitialNode() {
        WorkflowDefinition definition =
                new WorkflowDefinition("wf", "ghost", List.of(ProcessNode.of("a", "A")), List.of());

        WorkflowGraphValidator.Report report = validator.validate(definition);

        assertThat(report.isValid()).isFalse();
        assertThat(report.errors()).contains("Initial state node ghost not found");
        assertThat(report.warnings()).contains("nodes.a: unreachable from ghost");
    }

    @Test
    void shouldReportDanglingEdge() {
        WorkflowDefinition definition =
                new WorkflowDefinition(
                        "wf", "a", List.of(
                                ProcessNode.of("a", "A")), List.of(GraphEdge.of("a", "b")));

        WorkflowGraphValidator.Report report = validator.validate(definition);

        assertThat(report.errors()).anyMatch(e -> e.contains("target node b not found"));
    }

    @Test
    void shouldReportLoopOnExecutionPath() {
        WorkflowDefinition definition =
                new WorkflowDefinition(
                        "wf",
                        "a",
                        List.of(ProcessNode.of("a", "A"), ProcessNode.of("b", "B")),
                        List.of(GraphEdge.of("a", "b"), GraphEdge.of("b", "a")));

        WorkflowGraphValidator.Report report = validator.validate(definition);

        assertThat(report.isValid()).isFalse();
        assertThat(report.errors()).anyMatch(e -> e.startsWith("Execution path a -> b -> a"));
    }

    @Test
    void shouldWarnAboutCycleOffExecutionPath() {
        // Given
        WorkflowDefinition definition =
                new WorkflowDefinition(
                        "wf",
                        "a",
                        List.of(
                                ProcessNode.of("a", "A"),
                                ProcessNode.of("b", "B"),
                                ProcessNode.of("c", "C")),
                        List.of(
                                GraphEdge.of("a", "b"),
                                GraphEdge.of("a", "c"),
                                GraphEdge.of("c", "a")));

        // When
        WorkflowGraphValidator.Report report = validator.validate(definition);

        // Then
        assertThat(report.isValid()).isTrue();
        assertThat(report.warnings()).anyMatch(w -> w.startsWith("Graph contains a cycle"));
    }
}
