package io.conclave.cli.execution;

import io.conclave.cli.ui.AnsiStyles;
import io.conclave.core.routing.RoutingAgentInvoker;
import io.conclave.core.workflow.WorkflowListener;
import io.conclave.core.workflow.WorkflowResult;
import io.conclave.core.workflow.node.AgentNode;
import io.conclave.core.workflow.node.WorkflowNode;
import io.conclave.core.workflow.processor.NodeOutput;
import java.io.PrintStream;
import java.util.Map;

/// Workflow listener that prints each node's progress to the terminal.
///
/// ### Output Format
/// ```
/// ┌─────────────────────────────────────────────────────────────
/// │ [code] agent (coder)
/// │ processedBy: coder-1
/// │ result: ...
/// └─────────────────────────────────────────────────────────────
/// ```
///
/// Only the agent, result, decision and handoff entries of a node's output are shown.
///
/// @implNote **Not thread-safe**. The orchestrator never calls one listener concurrently
/// for a single execution.
public class VerboseWorkflowListener implements WorkflowListener {

    private static final int MAX_VALUE_LENGTH = 200;

    private final PrintStream out;
    private final AnsiStyles styles;

    public VerboseWorkflowListener(PrintStream out, boolean useColor) {
        this.out = out;
        this.styles = AnsiStyles.of(useColor);
    }

    @Override
    public void onStart(String executionId, String initialNodeId) {
        out.println(styles.gray("  Execution " + executionId + " starting at " + initialNodeId));
        out.println();
    }

    @Override
    public void onNodeComplete(String executionId, WorkflowNode node, NodeOutput output) {
        out.println(styles.separatorTop());
        out.printf(
                "%s %s %s%n",
                styles.boxMid(), styles.accent("[" + node.id() + "]"), describe(node));

        Map<String, Object> values = output.output();
        printEntry(values, RoutingAgentInvoker.PROCESSED_BY);
        printEntry(values, RoutingAgentInvoker.HANDOFF_ID);
        printEntry(values, RoutingAgentInvoker.RESULT);
        if (output.decision() != null) {
            out.printf("%s decision: %s%n", styles.boxMid(), styles.bold(output.decision()));
        }
        out.println(styles.separatorBottom());
    }

    @Override
    public void onComplete(WorkflowResult result) {
        String status = result.success() ? "success" : "failure";
        out.println();
        out.println(
                styles.gray("  Execution " + result.executionId() + " finished: ")
                        + styles.successOrError(status, result.success()));
    }

    private String describe(WorkflowNode node) {
        String kind = node.kind().wireName();
        if (node instanceof AgentNode agent) {
            return kind + " (" + agent.agentType().wireName() + ")";
        }
        return kind;
    }

    private void printEntry(Map<String, Object> values, String key) {
        Object value = values.get(key);
        if (value == null) {
            return;
        }
        String text = String.valueOf(value);
        if (text.length() > MAX_VALUE_LENGTH) {
            text = text.substring(0, MAX_VALUE_LENGTH) + "...";
        }
        out.printf("%s %s: %s%n", styles.boxMid(), styles.gray(key), text);
    }
}
