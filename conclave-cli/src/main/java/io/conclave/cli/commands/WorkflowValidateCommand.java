package io.conclave.cli.commands;

import io.conclave.core.workflow.WorkflowDefinition;
import io.conclave.core.workflow.WorkflowGraphValidator;
import io.conclave.core.workflow.node.AgentNode;
import java.nio.file.Path;
import picocli.CommandLine;

/// CLI command for validating a workflow definition file.
///
/// Parses the JSON and runs {@link WorkflowGraphValidator}: missing nodes, dangling edges
/// and first-edge cycles are errors, unreachable nodes and side cycles are warnings.
///
/// ### Usage
/// ```bash
/// conclave validate <workflow.json>
/// ```
///
/// Exits with `1` when the file cannot be parsed or the report holds errors.
@CommandLine.Command(name = "validate", description = "Validate a workflow definition")
class WorkflowValidateCommand extends WorkflowCommand {

    @CommandLine.Parameters(index = "0", description = "Workflow definition JSON file")
    private Path workflowFile;

    @Override
    protected int execute() {
        WorkflowDefinition definition;
        try {
            definition = loadDefinition(workflowFile);
        } catch (RuntimeException e) {
            System.err.println(" [FAIL] Validation failed: " + e.getMessage());
            return 1;
        }

        WorkflowGraphValidator.Report report = new WorkflowGraphValidator().validate(definition);
        for (String warning : report.warnings()) {
            System.out.println(" [WARN] " + warning);
        }
        if (!report.isValid()) {
            for (String error : report.errors()) {
                System.err.println(" [FAIL] " + error);
            }
            return 1;
        }

        long agentNodes = definition.nodes().stream().filter(AgentNode.class::isInstance).count();
        System.out.println(" [OK] Workflow is valid!");
        System.out.println("   Id: " + definition.id());
        System.out.println("   Initial node: " + definition.initialNodeId());
        System.out.println(
                "   Nodes: " + definition.nodes().size() + " (agent: " + agentNodes + ")");
        System.out.println("   Edges: " + definition.edges().size());
        return 0;
    }
}
