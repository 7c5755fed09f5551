package io.conclave.cli.commands;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Path;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class WorkflowRunCommandTest extends BaseCommandTest {

    @Nested
    class Execution {

        @Test
        void shouldRunPipelineWithDefaultRoster() throws Exception {
            // Given
            Path workflow = writeFile("pipeline.json", REVIEW_PIPELINE);

            // When
            int exitCode = execute("run", "--no-color", workflow.toString());

            // Then
            assertThat(exitCode).isZero();
            assertThat(output())
                    .contains("Workflow loaded: review-pipeline")
                    .contains("Agents: 3 registered")
                    .contains("Workflow completed successfully!")
                    .contains("Path: plan → code → review")
                    .contains("Final context: {")
                    .contains("\"processedBy\":\"reviewer-1\"");
        }

        @Test
        void shouldPrintNodeOutputsInVerboseMode() throws Exception {
            // Given
            Path workflow = writeFile("pipeline.json", REVIEW_PIPELINE);

            // When
            int exitCode =
                    execute(
                            "run",
                            "--no-color",
                            "-v",
                            "-c",
                            "{\"description\": \"build a parser\"}",
                            workflow.toString());

            // Then
            assertThat(exitCode).isZero();
            assertThat(output())
                    .contains("[code] agent (coder)")
                    .contains("processedBy: coder-1")
                    .contains("handoffId")
                    .contains("build a parser");
        }

        @Test
        void shouldUseAgentRosterFile() throws Exception {
            // Given
            Path workflow = writeFile("pipeline.json", REVIEW_PIPELINE);
            Path agents =
                    writeFile(
                            "agents.json",
                            """
                            {"agents": [
                              {"id": "ada", "type": "planner", "capacity": 2},
                              {"id": "linus", "type": "coder", "capacity": 2},
                              {"id": "grace", "type": "reviewer", "capacity": 2}
                            ]}
                            """);

            // When
            int exitCode =
                    execute(
                            "run",
                            "--no-color",
                            "-v",
                            "-a",
                            agents.toString(),
                            workflow.toString());

            // Then
            assertThat(exitCode).isZero();
            assertThat(output()).contains("processedBy: linus").contains("processedBy: grace");
        }

        @Test
        void shouldReadContextFromFile() throws Exception {
            // Given
            Path workflow = writeFile("pipeline.json", REVIEW_PIPELINE);
            Path context = writeFile("context.json", "{\"description\": \"tune the cache\"}");

            // When
            int exitCode =
                    execute(
                            "run",
                            "--no-color",
                            "-v",
                            "-c",
                            context.toString(),
                            workflow.toString());

            // Then
            assertThat(exitCode).isZero();
            assertThat(output()).contains("tune the cache");
        }
    }

    @Nested
    class Failures {

        @Test
        void shouldRefuseInvalidWorkflow() throws Exception {
            // Given
            Path workflow =
                    writeFile(
                            "invalid.json",
                            """
                            {"id": "wf", "initialNodeId": "missing",
                             "nodes": [{"id": "a", "kind": "decision"}]}
                            """);

            // When
            int exitCode = execute("run", "--no-color", workflow.toString());

            // Then
            assertThat(exitCode).isEqualTo(1);
            assertThat(errors()).contains("Workflow is invalid").contains("missing");
        }

        @Test
        void shouldReportMissingAgentTypeInRoster() throws Exception {
            // Given
            Path workflow = writeFile("pipeline.json", REVIEW_PIPELINE);
            Path agents =
                    writeFile(
                            "agents.json",
                            "[{\"id\": \"ada\", \"type\": \"planner\", \"capacity\": 1}]");

            // When
            int exitCode =
                    execute("run", "--no-color", "-a", agents.toString(), workflow.toString());

            // Then
            assertThat(exitCode).isEqualTo(1);
            assertThat(output()).contains("Workflow failed!").contains("Path: plan");
        }

        @Test
        void shouldRejectMalformedContext() throws Exception {
            Path workflow = writeFile("pipeline.json", REVIEW_PIPELINE);

            int exitCode = execute("run", "--no-color", "-c", "{broken", workflow.toString());

            assertThat(exitCode).isEqualTo(1);
            assertThat(errors()).contains("Failed to load workflow");
        }

        @Test
        void shouldRejectMalformedConfigValue() throws Exception {
            // Given
            Path workflow = writeFile("pipeline.json", REVIEW_PIPELINE);
            Path config = writeFile("bad.properties", "conclave.workflow.max-iterations=lots\n");

            // When
            int exitCode =
                    execute(
                            "run",
                            "--no-color",
                            "--config",
                            config.toString(),
                            workflow.toString());

            // Then
            assertThat(exitCode).isEqualTo(1);
            assertThat(errors()).contains("conclave.workflow.max-iterations");
        }
    }
}
