package io.conclave.cli.execution;

import static org.assertj.core.api.Assertions.assertThat;

import io.conclave.core.agent.AgentType;
import io.conclave.core.exception.CoordinationError;
import io.conclave.core.routing.RoutingAgentInvoker;
import io.conclave.core.workflow.WorkflowResult;
import io.conclave.core.workflow.node.AgentNode;
import io.conclave.core.workflow.node.DecisionNode;
import io.conclave.core.workflow.processor.NodeOutput;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class VerboseWorkflowListenerTest {

    private ByteArrayOutputStream buffer;
    private VerboseWorkflowListener listener;

    @BeforeEach
    void setUp() {
        buffer = new ByteArrayOutputStream();
        listener =
                new VerboseWorkflowListener(
                        new PrintStream(buffer, true, StandardCharsets.UTF_8), false);
    }

    private String printed() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    @Test
    void shouldPrintAgentOutputEntries() {
        // Given
        AgentNode node = new AgentNode("code", "Code", AgentType.CODER);
        NodeOutput output =
                NodeOutput.of(
                        Map.of(
                                RoutingAgentInvoker.PROCESSED_BY, "coder-1",
                                RoutingAgentInvoker.RESULT, "done",
                                RoutingAgentInvoker.TIMESTAMP, 42L));

        // When
        listener.onNodeComplete("exec-1", node, output);

        // Then
        assertThat(printed())
                .contains("[code] agent (coder)")
                .contains("processedBy: coder-1")
                .contains("result: done")
                .doesNotContain("timestamp");
    }

    @Test
    void shouldTruncateLongValues() {
        // Given
        String longResult = "x".repeat(500);
        NodeOutput output = NodeOutput.of(Map.of(RoutingAgentInvoker.RESULT, longResult));

        // When
        listener.onNodeComplete("exec-1", new AgentNode("c", "c", AgentType.CODER), output);

        // Then
        assertThat(printed()).contains("x".repeat(200) + "...").doesNotContain("x".repeat(201));
    }

    @Test
    void shouldPrintDecisionOutcome() {
        // When
        listener.onNodeComplete(
                "exec-1", new DecisionNode("gate", "gate"), new NodeOutput(Map.of(), "approved"));

        // Then
        assertThat(printed()).contains("[gate] decision").contains("decision: approved");
    }

    @Test
    void shouldPrintFinalStatus() {
        // When
        listener.onComplete(
                new WorkflowResult(
                        "exec-9",
                        false,
                        List.of("a"),
                        Map.of(),
                        CoordinationError.internal("boom")));

        // Then
        assertThat(printed()).contains("Execution exec-9 finished: failure");
    }
}
