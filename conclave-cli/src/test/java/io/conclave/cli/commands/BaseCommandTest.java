package io.conclave.cli.commands;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.io.TempDir;

/// Base class for CLI command tests with stream capture and fixture files.
abstract class BaseCommandTest {

    static final String REVIEW_PIPELINE =
            """
            {
              "id": "review-pipeline",
              "initialNodeId": "plan",
              "nodes": [
                {"id": "plan", "kind": "agent", "agentType": "planner", "label": "Plan"},
                {"id": "code", "kind": "agent", "agentType": "coder", "label": "Code"},
                {"id": "review", "kind": "agent", "agentType": "reviewer", "label": "Review"}
              ],
              "edges": [
                {"source": "plan", "target": "code"},
                {"source": "code", "target": "review"}
              ]
            }
            """;

    @TempDir Path tempDir;

    protected ByteArrayOutputStream outContent;
    protected ByteArrayOutputStream errContent;
    private PrintStream originalOut;
    private PrintStream originalErr;

    @BeforeEach
    void setUpStreams() {
        originalOut = System.out;
        originalErr = System.err;
        outContent = new ByteArrayOutputStream();
        errContent = new ByteArrayOutputStream();
        System.setOut(new PrintStream(outContent, true, StandardCharsets.UTF_8));
        System.setErr(new PrintStream(errContent, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void restoreStreams() {
        System.setOut(originalOut);
        System.setErr(originalErr);
    }

    /// Runs the CLI as `main` would, without exiting the JVM.
    protected int execute(String... args) {
        return ConclaveCli.newCommandLine().execute(args);
    }

    protected Path writeFile(String name, String content) throws IOException {
        return Files.writeString(tempDir.resolve(name), content, StandardCharsets.UTF_8);
    }

    protected String output() {
        return outContent.toString(StandardCharsets.UTF_8);
    }

    protected String errors() {
        return errContent.toString(StandardCharsets.UTF_8);
    }
}
