package io.conclave.cli.commands;

import io.conclave.core.ConclaveConfig;
import io.conclave.core.agent.Agent;
import io.conclave.core.workflow.WorkflowDefinition;
import io.conclave.serialization.ConclaveJson;
import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Properties;
import java.util.logging.Logger;
import picocli.CommandLine.Option;

/// Base class for commands that load workflow definitions, agent rosters and settings.
///
/// ### Configuration Resolution
/// Later sources override earlier ones, key by key:
/// 1. `conclave.properties` on the classpath
/// 2. The file given with `--config`
/// 3. JVM system properties starting with `conclave.`
///
/// @implNote Subclasses must be package-private and annotated with `@Command`.
/// @see WorkflowRunCommand
/// @see WorkflowValidateCommand
/// @see TaskRouteCommand
public abstract class WorkflowCommand extends ConclaveCommand {

    private static final Logger logger = Logger.getLogger(WorkflowCommand.class.getName());

    static final String CLASSPATH_CONFIG = "conclave.properties";

    @Option(
            names = {"--config"},
            description = "Properties file overriding the bundled conclave.properties")
    protected Path configFile;

    /// Reads and parses a workflow definition file.
    ///
    /// @param file JSON file, not null
    /// @return parsed definition, not yet validated, never null
    /// @throws UncheckedIOException if the file cannot be read
    /// @throws IllegalArgumentException if the JSON is not a workflow definition
    protected WorkflowDefinition loadDefinition(Path file) {
        return ConclaveJson.definitionFromJson(readFile(file));
    }

    /// Reads and parses an agent roster file.
    ///
    /// @param file JSON file holding an array of agents or an `{"agents": [...]}` object
    /// @return agents in file order, never null
    protected List<Agent> loadAgents(Path file) {
        return ConclaveJson.agentsFromJson(readFile(file));
    }

    /// Builds the effective configuration.
    ///
    /// @return configuration, never null
    /// @throws UncheckedIOException if a properties source cannot be read
    /// @throws IllegalArgumentException if a numeric setting is malformed
    protected ConclaveConfig loadConfig() {
        Properties properties = new Properties();
        try (InputStream in =
                WorkflowCommand.class.getClassLoader().getResourceAsStream(CLASSPATH_CONFIG)) {
            if (in != null) {
                properties.load(in);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + CLASSPATH_CONFIG, e);
        }

        if (configFile != null) {
            try (Reader reader = Files.newBufferedReader(configFile, StandardCharsets.UTF_8)) {
                properties.load(reader);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read config file " + configFile, e);
            }
            logger.fine("Loaded settings from " + configFile);
        }

        System.getProperties().stringPropertyNames().stream()
                .filter(key -> key.startsWith(ConclaveConfig.PREFIX))
                .forEach(key -> properties.setProperty(key, System.getProperty(key)));

        return ConclaveConfig.fromProperties(properties);
    }

    protected static String readFile(Path file) {
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + file, e);
        }
    }
}
