package io.conclave.cli.commands;

import picocli.CommandLine;

/// Minimal abstract base for all Conclave CLI commands.
///
/// Owns the banner display and the {@link #run()} / {@link #execute()} contract.
/// The value returned by {@link #execute()} becomes the process exit code.
///
/// @see WorkflowCommand
public abstract class ConclaveCommand implements Runnable, CommandLine.IExitCodeGenerator {

    private static final String[] BANNER = {
        "",
        "   ___  ___  _ __    ___ | |  __ _ __   __ ___",
        "  / __|/ _ \\| '_ \\  / __|| | / _` |\\ \\ / // _ \\",
        " | (__| (_) | | | || (__ | || (_| | \\ V /|  __/",
        "  \\___|\\___/|_| |_| \\___||_| \\__,_|  \\_/  \\___|",
        "",
        " Multi-Agent Coordination",
        ""
    };

    private int exitCode;

    @Override
    public final void run() {
        for (String line : BANNER) {
            System.out.println(line);
        }
        exitCode = execute();
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    /// Runs the command.
    ///
    /// @return process exit code, `0` on success
    protected abstract int execute();
}
