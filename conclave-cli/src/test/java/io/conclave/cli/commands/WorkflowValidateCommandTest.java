package io.conclave.cli.commands;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Path;
import org.junit.jupiter.api.Test;

class WorkflowValidateCommandTest extends BaseCommandTest {

    @Test
    void shouldValidateWorkflowSuccessfully() throws Exception {
        // Given
        Path workflow = writeFile("pipeline.json", REVIEW_PIPELINE);

        // When
        int exitCode = execute("validate", workflow.toString());

        // Then
        assertThat(exitCode).isZero();
        assertThat(output())
                .contains("Workflow is valid")
                .contains("Id: review-pipeline")
                .contains("Nodes: 3 (agent: 3)")
                .contains("Edges: 2");
    }

    @Test
    void shouldReportDanglingEdgeAsError() throws Exception {
        // Given
        Path workflow =
                writeFile(
                        "dangling.json",
                        """
                        {"id": "wf", "initialNodeId": "a",
                         "nodes": [{"id": "a", "kind": "decision"}],
                         "edges": [{"source": "a", "target": "ghost"}]}
                        """);

        // When
        int exitCode = execute("validate", workflow.toString());

        // Then
        assertThat(exitCode).isEqualTo(1);
        assertThat(errors()).contains("target node ghost not found");
        assertThat(output()).doesNotContain("Workflow is valid");
    }

    @Test
    void shouldWarnAboutUnreachableNode() throws Exception {
        // Given
        Path workflow =
                writeFile(
                        "orphan.json",
                        """
                        {"id": "wf", "initialNodeId": "a",
                         "nodes": [{"id": "a", "kind": "decision"},
                                   {"id": "orphan", "kind": "process"}]}
                        """);

        // When
        int exitCode = execute("validate", workflow.toString());

        // Then
        assertThat(exitCode).isZero();
        assertThat(output()).contains("[WARN]").contains("orphan");
    }

    @Test
    void shouldFailOnUnknownNodeKind() throws Exception {
        // Given
        Path workflow =
                writeFile(
                        "unknown.json",
                        """
                        {"id": "wf", "initialNodeId": "a",
                         "nodes": [{"id": "a", "kind": "teleport"}]}
                        """);

        // When
        int exitCode = execute("validate", workflow.toString());

        // Then
        assertThat(exitCode).isEqualTo(1);
        assertThat(errors()).contains("Validation failed").contains("Unknown node type");
    }

    @Test
    void shouldFailOnMissingFile() {
        int exitCode = execute("validate", tempDir.resolve("missing.json").toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(errors()).contains("Failed to read");
    }
}
