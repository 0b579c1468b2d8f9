package com.dumpgraph;

import com.dumpgraph.cli.InspectCommand;
import com.dumpgraph.cli.VerifyCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ch.qos.logback.classic.Level;

/**
 * Main CLI entry point for DumpGraph.
 *
 * <p>DumpGraph reads the dump files written by a C/C++ static analyzer and checks them
 * against the structure rule checkers rely on.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code inspect} - Print document facts and per-configuration record counts</li>
 *   <li>{@code verify} - Resolve every configuration and check the graph invariants</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * dumpgraph inspect main.c.dump
 * dumpgraph inspect --json main.c.dump
 * dumpgraph -v verify main.c.dump
 * }</pre>
 */
@Command(
    name = "dumpgraph",
    mixinStandardHelpOptions = true,
    version = "DumpGraph 1.0.0-SNAPSHOT",
    description = "Reads and verifies static analyzer dump files",
    subcommands = {
        InspectCommand.class,
        VerifyCommand.class
    }
)
public class DumpGraphCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(DumpGraphCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        configureLogging();

        if (quiet) {
            return;
        }

        System.out.println("DumpGraph - static analyzer dump reader");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'dumpgraph --help' to see available commands");
    }

    /**
     * Sets the root log level from the global options. Called by each subcommand, since
     * picocli only runs the innermost command.
     */
    public void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
        log.debug("Log level set to {}", root.getLevel());
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = new CommandLine(new DumpGraphCLI()).execute(args);
        System.exit(exitCode);
    }
}
