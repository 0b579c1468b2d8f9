package com.dumpgraph.cli;

import com.dumpgraph.DumpGraphCLI;
import com.dumpgraph.core.DumpFormatException;
import com.dumpgraph.core.config.ConfigLoader;
import com.dumpgraph.core.config.ParserConfig;
import com.dumpgraph.core.model.Configuration;
import com.dumpgraph.core.model.Standards;
import com.dumpgraph.core.parser.ConfigurationIterator;
import com.dumpgraph.core.parser.DumpDocument;
import com.dumpgraph.core.parser.DumpParser;
import com.dumpgraph.cli.InspectReport.ConfigurationSummary;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
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
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to print what a dump contains.
 *
 * <p>Reads the document-level facts and walks every configuration, printing record counts.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * dumpgraph inspect main.c.dump
 * dumpgraph inspect --json main.c.dump > summary.json
 * }</pre>
 */
@Command(
    name = "inspect",
    description = "Print document facts and per-configuration record counts",
    mixinStandardHelpOptions = true
)
public class InspectCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(InspectCommand.class);

    @ParentCommand
    private DumpGraphCLI parent;

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Dump file to inspect")
    private Path dumpFile;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: dumpgraph.yaml)"
    )
    private Path configPath = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);

    @Option(names = {"--json"}, description = "Print the summary as JSON")
    private boolean json;

    @Override
    public Integer call() {
        if (parent != null) {
            parent.configureLogging();
        }
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        try {
            ParserConfig config = ConfigLoader.load(configPath);
            DumpDocument document = DumpParser.open(dumpFile, config);

            List<ConfigurationSummary> summaries = new ArrayList<>();
            try (ConfigurationIterator configurations = document.configurations()) {
                while (configurations.hasNext()) {
                    Configuration configuration = configurations.next();
                    summaries.add(ConfigurationSummary.of(configuration));
                }
            }

            InspectReport report = InspectReport.of(document, summaries);
            if (json) {
                printJson(report, out);
            } else {
                printText(report, out);
            }
            out.flush();
            return 0;
        } catch (IOException | UncheckedIOException | DumpFormatException e) {
            log.error("Inspection of {} failed", dumpFile, e);
            err.println("Error: " + e.getMessage());
            err.flush();
            return 1;
        }
    }

    private static void printJson(InspectReport report, PrintWriter out) throws IOException {
        ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
        out.println(mapper.writeValueAsString(report));
    }

    private static void printText(InspectReport report, PrintWriter out) {
        out.println("Dump: " + report.source());
        if (report.platform() != null) {
            out.printf("Platform: %s (char %d, short %d, int %d, long %d, long long %d, pointer %d bits)%n",
                report.platform().name(), report.platform().charBit(), report.platform().shortBit(),
                report.platform().intBit(), report.platform().longBit(), report.platform().longLongBit(),
                report.platform().pointerBit());
        } else {
            out.println("Platform: none");
        }
        out.println("Files: " + report.files());
        out.println("Raw tokens: " + report.rawTokens());
        out.println("Suppressions: " + report.suppressions());
        out.println("Configurations: " + report.configurations().size());

        for (ConfigurationSummary summary : report.configurations()) {
            out.println();
            out.println("  Configuration '" + summary.name() + "'");
            Standards standards = summary.standards();
            if (standards != null) {
                out.printf("    Standards: c=%s cpp=%s posix=%s%n", standards.c(), standards.cpp(), standards.posix());
            }
            out.println("    Directives: " + summary.directives());
            out.println("    Tokens: " + summary.tokens());
            out.println("    Scopes: " + summary.scopes());
            out.println("    Functions: " + summary.functions());
            out.println("    Variables: " + summary.variables());
            out.println("    Argument variables: " + summary.argumentVariables());
            out.println("    Value lists: " + summary.valueFlows());
        }
    }
}
