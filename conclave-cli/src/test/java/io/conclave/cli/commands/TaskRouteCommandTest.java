package io.conclave.cli.commands;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TaskRouteCommandTest extends BaseCommandTest {

    private Path roster;

    @BeforeEach
    void setUp() throws Exception {
        roster =
                writeFile(
                        "agents.json",
                        """
                        [
                          {"id": "coder-a", "type": "coder", "expertise": ["frontend"],
                           "capacity": 4},
                          {"id": "coder-b", "type": "coder", "expertise": ["parser", "compiler"],
                           "capacity": 4},
                          {"id": "reviewer-a", "type": "reviewer", "capacity": 2}
                        ]
                        """);
    }

    @Test
    void shouldRouteToAgentWithMatchingExpertise() {
        // When
        int exitCode =
                execute(
                        "route",
                        "--no-color",
                        roster.toString(),
                        "-t",
                        "code_generation",
                        "-d",
                        "write a parser for the config format");

        // Then
        assertThat(exitCode).isZero();
        assertThat(output()).contains("cli-task → coder-b").contains("Degraded: false");
    }

    @Test
    void shouldAcceptPriorityInAnyCase() {
        int exitCode =
                execute(
                        "route", "--no-color", roster.toString(), "-t", "code_review", "-p",
                        "high", "--id", "review-42");

        assertThat(exitCode).isZero();
        assertThat(output()).contains("review-42 → reviewer-a");
    }

    @Test
    void shouldFailWhenNoAgentIsCompatible() {
        // When
        int exitCode = execute("route", "--no-color", roster.toString(), "-t", "research");

        // Then
        assertThat(exitCode).isEqualTo(1);
        assertThat(errors())
                .contains("Routing failed")
                .contains("No registered agent is compatible with task type: research");
    }

    @Test
    void shouldRequireTaskType() {
        int exitCode = execute("route", roster.toString());

        assertThat(exitCode).isEqualTo(2);
    }
}
