package com.dumpgraph.cli;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link VerifyCommand}.
 */
class VerifyCommandTest extends CommandTestBase {

    private static final String TWO_CONFIGURATIONS_ONE_UNRESOLVED = """
        <?xml version="1.0"?>
        <dumps>
          <rawtokens>
            <file index="0" name="bad.c"/>
          </rawtokens>
          <dump cfg="A">
            <tokenlist>
              <token id="a1" file="bad.c" linenr="1" column="1" str="x" type="name" scope="s1" astParent="a404"/>
            </tokenlist>
            <scopes>
              <scope id="s1" type="Global" className="" nestedIn="0"/>
            </scopes>
          </dump>
          <dump cfg="B">
            <tokenlist>
              <token id="b1" file="bad.c" linenr="2" column="1" str="y" type="name" scope="s2" astParent="0"/>
            </tokenlist>
            <scopes>
              <scope id="s2" type="Global" className="" nestedIn="0"/>
            </scopes>
          </dump>
        </dumps>
        """;

    private static final String TWO_ROOT_SCOPES = """
        <?xml version="1.0"?>
        <dumps>
          <dump cfg="">
            <tokenlist>
              <token id="t1" file="a.c" linenr="1" column="1" str="x" type="name" scope="s1"/>
            </tokenlist>
            <scopes>
              <scope id="s1" type="Global" className="" nestedIn="0"/>
              <scope id="s2" type="Global" className="" nestedIn="0"/>
            </scopes>
          </dump>
        </dumps>
        """;

    @Test
    void verify_validDump_returnsZero() throws IOException {
        // Given
        Path dump = createDump("main.c.dump", GOOD_DUMP);

        // When
        int exitCode = run("verify", "-c", noConfig(), dump.toString());

        // Then
        assertThat(exitCode).isZero();
        assertThat(out.toString())
            .contains("OK    configuration ''")
            .contains("1 configurations checked, 0 failed");
    }

    @Test
    void verify_unresolvedConfiguration_reportsAndContinues() throws IOException {
        // Given: configuration A references a missing token, B is sound
        Path dump = createDump("bad.dump", TWO_CONFIGURATIONS_ONE_UNRESOLVED);

        // When
        int exitCode = run("verify", "-c", noConfig(), dump.toString());

        // Then: A fails, B is still checked
        String output = out.toString();
        assertThat(exitCode).isEqualTo(1);
        assertThat(output)
            .contains("FAIL  ")
            .contains("a404")
            .contains("OK    configuration 'B'")
            .contains("2 configurations checked, 1 failed");
    }

    @Test
    void verify_invariantViolation_listsRule() throws IOException {
        // Given: a configuration with two global scopes
        Path dump = createDump("roots.dump", TWO_ROOT_SCOPES);

        // When
        int exitCode = run("verify", "-c", noConfig(), dump.toString());

        // Then
        assertThat(exitCode).isEqualTo(1);
        assertThat(out.toString())
            .contains("FAIL  configuration ''")
            .contains("SCOPE_ROOT");
    }

    @Test
    void verify_configWithVerifyGraph_stillReportsViolationsPerConfiguration() throws IOException {
        // Given: a configuration file asking the parser to verify while reading
        Path dump = createDump("roots.dump", TWO_ROOT_SCOPES);
        Path config = createDump("dumpgraph.yaml", "verifyGraph: true\n");

        // When
        int exitCode = run("verify", "-c", config.toString(), dump.toString());

        // Then: the command reports the violation instead of aborting
        assertThat(exitCode).isEqualTo(1);
        assertThat(out.toString()).contains("SCOPE_ROOT");
        assertThat(err.toString()).isEmpty();
    }

    @Test
    void verify_missingFile_returnsError() {
        int exitCode = run("verify", "-c", noConfig(), tempDir.resolve("missing.dump").toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("Error:");
    }
}
