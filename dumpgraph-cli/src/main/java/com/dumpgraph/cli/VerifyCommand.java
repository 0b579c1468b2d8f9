package com.dumpgraph.cli;

import com.dumpgraph.DumpGraphCLI;
import com.dumpgraph.core.DumpFormatException;
import com.dumpgraph.core.UnresolvedIdentifierException;
import com.dumpgraph.core.config.ConfigLoader;
import com.dumpgraph.core.config.ParserConfig;
import com.dumpgraph.core.model.Configuration;
import com.dumpgraph.core.parser.ConfigurationIterator;
import com.dumpgraph.core.parser.DumpDocument;
import com.dumpgraph.core.parser.DumpParser;
import com.dumpgraph.core.verify.GraphVerifier;
import com.dumpgraph.core.verify.Violation;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to check a dump against the graph invariants.
 *
 * <p>Every configuration is resolved and verified. A configuration with an unresolved
 * identifier is reported and skipped; checking continues with the next one. Any other
 * structural error stops the run.
 *
 * <p><b>Exit codes:</b> 0 if every configuration resolved and verified, 1 otherwise.
 */
@Command(
    name = "verify",
    description = "Resolve every configuration and check the graph invariants",
    mixinStandardHelpOptions = true
)
public class VerifyCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(VerifyCommand.class);

    @ParentCommand
    private DumpGraphCLI parent;

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Dump file to verify")
    private Path dumpFile;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: dumpgraph.yaml)"
    )
    private Path configPath = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);

    @Override
    public Integer call() {
        if (parent != null) {
            parent.configureLogging();
        }
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        // violations are collected here rather than thrown by the iterator
        ParserConfig loaded = ConfigLoader.load(configPath);
        ParserConfig config = new ParserConfig(loaded.reader(), false);
        GraphVerifier verifier = new GraphVerifier();

        int checked = 0;
        int failed = 0;
        try {
            DumpDocument document = DumpParser.open(dumpFile, config);
            try (ConfigurationIterator configurations = document.configurations()) {
                while (true) {
                    Configuration configuration;
                    try {
                        if (!configurations.hasNext()) {
                            break;
                        }
                        configuration = configurations.next();
                    } catch (UnresolvedIdentifierException e) {
                        checked++;
                        failed++;
                        out.println("FAIL  " + e.getMessage());
                        continue;
                    }
                    checked++;
                    List<Violation> violations = verifier.verify(configuration);
                    if (violations.isEmpty()) {
                        out.println("OK    configuration '" + configuration.name() + "'");
                    } else {
                        failed++;
                        out.println("FAIL  configuration '" + configuration.name() + "'");
                        for (Violation violation : violations) {
                            out.println("      " + violation);
                        }
                    }
                }
            }
        } catch (IOException | UncheckedIOException | DumpFormatException e) {
            log.error("Verification of {} failed", dumpFile, e);
            err.println("Error: " + e.getMessage());
            err.flush();
            return 1;
        }

        out.println();
        out.printf("%d configurations checked, %d failed%n", checked, failed);
        out.flush();
        log.info("Verified {}: {} configurations, {} failed", dumpFile, checked, failed);
        return failed == 0 ? 0 : 1;
    }
}
