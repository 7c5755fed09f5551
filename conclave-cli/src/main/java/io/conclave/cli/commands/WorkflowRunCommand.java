package io.conclave.cli.commands;

import io.conclave.cli.execution.VerboseWorkflowListener;
import io.conclave.cli.ui.AnsiStyles;
import io.conclave.core.ConclaveEnvironment;
import io.conclave.core.ConclaveFactory;
import io.conclave.core.agent.Agent;
import io.conclave.core.agent.AgentRegistry;
import io.conclave.core.agent.AgentType;
import io.conclave.core.workflow.WorkflowDefinition;
import io.conclave.core.workflow.WorkflowGraphValidator;
import io.conclave.core.workflow.WorkflowListener;
import io.conclave.core.workflow.WorkflowOrchestrator;
import io.conclave.core.workflow.WorkflowResult;
import io.conclave.core.workflow.node.AgentNode;
import io.conclave.serialization.ConclaveJson;
import java.nio.file.Path;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/// CLI command for executing a workflow graph with routed agents.
///
/// Agent nodes are routed through the task router and run on the stub execution engine,
/// so a run exercises routing, workload accounting and context handoffs without any
/// model behind the agents.
///
/// ### Usage
/// ```bash
/// conclave run [-v] [--no-color] [-c <context>] [-a <agents.json>] [--config <file>]
///     <workflow.json>
/// ```
///
/// ### Options
/// - `-c, --context` - Initial context as JSON string or path to a JSON file
/// - `-a, --agents` - Agent roster. Without it one agent per referenced type is registered
/// - `-v, --verbose` - Print each node's output
/// - `--no-color` - Disable ANSI color output
@Command(name = "run", description = "Run a workflow")
class WorkflowRunCommand extends WorkflowCommand {

    private static final Logger logger = Logger.getLogger(WorkflowRunCommand.class.getName());

    // Held so the level set by --verbose is not lost when the logger is collected.
    private static final Logger CONCLAVE_LOGGER = Logger.getLogger("io.conclave");

    static final int DEFAULT_AGENT_CAPACITY = 5;

    @Parameters(index = "0", description = "Workflow definition JSON file")
    private Path workflowFile;

    @Option(
            names = {"-c", "--context"},
            description = "Context as JSON string or path to JSON file")
    private String contextInput;

    @Option(
            names = {"-a", "--agents"},
            description = "Agent roster JSON file")
    private Path agentsFile;

    @Option(
            names = {"-v", "--verbose"},
            description = "Show node outputs")
    private boolean verbose = false;

    @Option(
            names = {"--no-color"},
            description = "Disable colored output",
            negatable = true)
    private boolean color = true;

    @Override
    protected int execute() {
        AnsiStyles styles = AnsiStyles.of(color);

        WorkflowDefinition definition;
        Map<String, Object> context;
        try {
            definition = loadDefinition(workflowFile);
            context = loadContext(contextInput);
        } catch (RuntimeException e) {
            System.err.printf(
                    "%s %s %s%n",
                    styles.crossmark(), styles.bold("Failed to load workflow:"), e.getMessage());
            return 1;
        }

        WorkflowGraphValidator.Report report = new WorkflowGraphValidator().validate(definition);
        if (!report.isValid()) {
            System.err.printf("%s %s%n", styles.crossmark(), styles.bold("Workflow is invalid:"));
            report.errors().forEach(error -> System.err.println("  " + error));
            return 1;
        }
        report.warnings().forEach(warning -> System.out.println(styles.warn("  " + warning)));

        System.out.printf(
                "%n%s %s%n",
                styles.checkmark(), styles.bold("Workflow loaded: " + definition.id()));
        System.out.printf(
                "%s%n%n",
                styles.gray(
                        "  Nodes: "
                                + definition.nodes().size()
                                + " "
                                + styles.bullet()
                                + " Edges: "
                                + definition.edges().size()));

        try (ConclaveEnvironment environment = ConclaveFactory.createEnvironment(loadConfig())) {
            List<Agent> agents = registerAgents(environment.getAgentRegistry(), definition);
            System.out.println(
                    styles.gray("  Agents: " + agents.size() + " registered, starting execution"));
            if (verbose) {
                CONCLAVE_LOGGER.setLevel(Level.FINE);
                System.out.println(styles.gray("  (verbose mode enabled)"));
            }
            System.out.println();

            WorkflowListener listener =
                    verbose
                            ? new VerboseWorkflowListener(System.out, color)
                            : WorkflowListener.NOOP;
            WorkflowOrchestrator orchestrator =
                    environment
                            .orchestratorBuilder(definition.initialNodeId())
                            .listener(listener)
                            .build();
            orchestrator.load(definition);

            WorkflowResult result = orchestrator.executeWorkflow(context);
            return printResult(result, styles);
        } catch (RuntimeException e) {
            logger.log(Level.FINE, "Workflow run failed", e);
            System.err.printf(
                    "%s %s %s%n",
                    styles.crossmark(), styles.bold("Workflow execution failed:"), e.getMessage());
            return 1;
        }
    }

    private int printResult(WorkflowResult result, AnsiStyles styles) {
        int exitCode = printOutcome(result, styles);
        String context = ConclaveJson.contextToJson(result.finalContext());
        System.out.println(styles.gray("  Final context: ") + context);
        return exitCode;
    }

    private int printOutcome(WorkflowResult result, AnsiStyles styles) {
        String path = String.join(" " + styles.arrow() + " ", result.executionPath());
        if (result.success()) {
            System.out.printf(
                    "%n%s %s%n",
                    styles.checkmark(),
                    styles.bold("Workflow completed successfully!"));
            System.out.printf(
                    "  Steps: %d %s Path: %s%n",
                    result.executionPath().size(), styles.bullet(), path);
            return 0;
        }
        System.out.printf("%n%s %s%n", styles.crossmark(), styles.bold("Workflow failed!"));
        System.out.printf(
                "  %s: %s%n",
                styles.error(result.error().kind().name()), result.error().message());
        if (!result.executionPath().isEmpty()) {
            System.out.printf("  Path: %s%n", path);
        }
        return 1;
    }

    private List<Agent> registerAgents(AgentRegistry registry, WorkflowDefinition definition) {
        if (agentsFile != null) {
            List<Agent> agents = loadAgents(agentsFile);
            agents.forEach(registry::register);
            return agents;
        }

        Set<AgentType> types = EnumSet.noneOf(AgentType.class);
        definition.nodes().stream()
                .filter(AgentNode.class::isInstance)
                .map(node -> ((AgentNode) node).agentType())
                .forEach(types::add);
        List<Agent> agents =
                types.stream()
                        .map(type -> Agent.of(type.wireName() + "-1", type, DEFAULT_AGENT_CAPACITY))
                        .toList();
        agents.forEach(registry::register);
        logger.fine("Registered default roster: " + agents);
        return agents;
    }

    /// Loads context from a JSON string or file path. Input starting with `{` is JSON.
    private Map<String, Object> loadContext(String input) {
        if (input == null || input.isBlank()) {
            return new HashMap<>();
        }
        String json = input.trim().startsWith("{") ? input : readFile(Path.of(input));
        return ConclaveJson.contextFromJson(json);
    }
}
