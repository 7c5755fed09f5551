package io.conclave.cli.commands;

import io.conclave.cli.ui.AnsiStyles;
import io.conclave.core.ConclaveEnvironment;
import io.conclave.core.ConclaveFactory;
import io.conclave.core.agent.Task;
import io.conclave.core.agent.TaskPriority;
import io.conclave.core.exception.CoordinationException;
import io.conclave.core.routing.RoutingResult;
import io.conclave.core.routing.TaskRouter;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/// CLI command that routes a single task against an agent roster and explains the choice.
///
/// ### Usage
/// ```bash
/// conclave route <agents.json> -t <task-type> -d <description> [-p LOW|MEDIUM|HIGH]
/// ```
///
/// Routing weights come from the effective configuration, so `--config` can be used to
/// compare weightings on the same roster.
@Command(name = "route", description = "Route a task to the best agent in a roster")
class TaskRouteCommand extends WorkflowCommand {

    @Parameters(index = "0", description = "Agent roster JSON file")
    private Path agentsFile;

    @Option(
            names = {"-t", "--type"},
            required = true,
            description = "Task type, e.g. code_generation")
    private String taskType;

    @Option(
            names = {"-d", "--description"},
            description = "Task description used for expertise matching")
    private String description = "";

    @Option(
            names = {"-p", "--priority"},
            description = "Task priority: ${COMPLETION-CANDIDATES}")
    private TaskPriority priority = TaskPriority.MEDIUM;

    @Option(
            names = {"--id"},
            description = "Task id")
    private String taskId = "cli-task";

    @Option(
            names = {"--no-color"},
            description = "Disable colored output",
            negatable = true)
    private boolean color = true;

    @Override
    protected int execute() {
        AnsiStyles styles = AnsiStyles.of(color);
        try (ConclaveEnvironment environment = ConclaveFactory.createEnvironment(loadConfig())) {
            loadAgents(agentsFile).forEach(environment.getAgentRegistry()::register);

            TaskRouter router = environment.getTaskRouter();
            Task task = new Task(taskId, description, taskType, priority, Map.of());
            RoutingResult result = router.routeTask(task);

            System.out.printf(
                    "%s %s %s %s%n",
                    result.degraded() ? styles.warn("!") : styles.checkmark(),
                    styles.bold(task.id()),
                    styles.arrow(),
                    styles.accent(result.agentId()));
            System.out.printf(
                    Locale.ROOT,
                    "  Confidence: %.2f %s Degraded: %s%n",
                    result.confidence(), styles.bullet(), result.degraded());
            System.out.println("  " + styles.gray(result.reasoning()));
            return 0;
        } catch (CoordinationException e) {
            System.err.printf(
                    "%s %s %s%n",
                    styles.crossmark(), styles.bold("Routing failed:"), e.getMessage());
            return 1;
        } catch (RuntimeException e) {
            System.err.printf(
                    "%s %s %s%n",
                    styles.crossmark(), styles.bold("Failed to route task:"), e.getMessage());
            return 1;
        }
    }
}
