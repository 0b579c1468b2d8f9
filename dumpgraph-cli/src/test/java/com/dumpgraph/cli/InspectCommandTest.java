package com.dumpgraph.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link InspectCommand}.
 */
class InspectCommandTest extends CommandTestBase {

    @Test
    void inspect_validDump_printsDocumentFactsAndCounts() throws IOException {
        // Given: a dump with one configuration
        Path dump = createDump("main.c.dump", GOOD_DUMP);

        // When: inspecting it
        int exitCode = run("inspect", "-c", noConfig(), dump.toString());

        // Then: facts and record counts are printed
        String output = out.toString();
        assertThat(exitCode).isZero();
        assertThat(output)
            .contains("Platform: unix64")
            .contains("pointer 64 bits")
            .contains("Files: [main.c]")
            .contains("Raw tokens: 3")
            .contains("Suppressions: 1")
            .contains("Configurations: 1")
            .contains("  Configuration ''")
            .contains("Standards: c=c11 cpp=c++17")
            .contains("Tokens: 3")
            .contains("Scopes: 1")
            .contains("Variables: 1");
        assertThat(err.toString()).isEmpty();
    }

    @Test
    void inspect_jsonFlag_printsParsableSummary() throws IOException {
        // Given: a dump with one configuration
        Path dump = createDump("main.c.dump", GOOD_DUMP);

        // When: inspecting it as JSON
        int exitCode = run("inspect", "--json", "-c", noConfig(), dump.toString());

        // Then: the output is a JSON report
        assertThat(exitCode).isZero();
        JsonNode report = new ObjectMapper().readTree(out.toString());
        assertThat(report.get("rawTokens").asInt()).isEqualTo(3);
        assertThat(report.get("configurations")).hasSize(1);
        assertThat(report.get("configurations").get(0).get("tokens").asInt()).isEqualTo(3);
    }

    @Test
    void inspect_unresolvedIdentifier_returnsError() throws IOException {
        // Given: a dump whose token points at a missing scope
        Path dump = createDump("bad.dump", GOOD_DUMP.replace("scope=\"s1\" type=\"op\"", "scope=\"s9\" type=\"op\""));

        // When: inspecting it
        int exitCode = run("inspect", "-c", noConfig(), dump.toString());

        // Then: the error names the identifier
        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("Error:").contains("s9");
    }

    @Test
    void inspect_missingFile_returnsError() {
        // When: inspecting a path that does not exist
        int exitCode = run("inspect", "-c", noConfig(), tempDir.resolve("missing.dump").toString());

        // Then
        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("Error:");
    }

    @Test
    void inspect_malformedXml_returnsError() throws IOException {
        // Given: a truncated document
        Path dump = createDump("broken.dump", "<?xml version=\"1.0\"?>\n<dumps>\n  <dump cfg=\"\">\n");

        // When
        int exitCode = run("inspect", "-c", noConfig(), dump.toString());

        // Then
        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("Error:");
    }
}
