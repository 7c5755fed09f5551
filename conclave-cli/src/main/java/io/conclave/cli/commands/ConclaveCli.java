package io.conclave.cli.commands;

import java.io.IOException;
import java.io.InputStream;
import java.util.logging.LogManager;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/// Main entry point for the Conclave CLI application.
///
/// Registers all available subcommands:
/// - `run` - Execute a workflow graph with routed agents
/// - `validate` - Check a workflow definition for structural errors
/// - `route` - Route one task against an agent roster
///
/// @see WorkflowRunCommand
/// @see WorkflowValidateCommand
/// @see TaskRouteCommand
@Command(
        name = "conclave",
        description = "Conclave Multi-Agent Coordination",
        mixinStandardHelpOptions = true,
        version = "conclave 0.1.0",
        subcommands = {
            WorkflowRunCommand.class,
            WorkflowValidateCommand.class,
            TaskRouteCommand.class
        })
public class ConclaveCli {

    static final String LOGGING_CONFIG = "logging.properties";

    public static void main(String[] args) {
        configureLogging();
        System.exit(newCommandLine().execute(args));
    }

    static CommandLine newCommandLine() {
        return new CommandLine(new ConclaveCli()).setCaseInsensitiveEnumValuesAllowed(true);
    }

    private static void configureLogging() {
        if (System.getProperty("java.util.logging.config.file") != null) {
            return;
        }
        ClassLoader loader = ConclaveCli.class.getClassLoader();
        try (InputStream in = loader.getResourceAsStream(LOGGING_CONFIG)) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            System.err.println("Failed to load " + LOGGING_CONFIG + ": " + e.getMessage());
        }
    }
}
