package com.dumpgraph.cli;

import com.dumpgraph.DumpGraphCLI;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Base class for command tests. Runs the CLI against dumps written to a temporary directory
 * and captures what it prints.
 */
abstract class CommandTestBase {

    static final String GOOD_DUMP = """
        <?xml version="1.0"?>
        <dumps>
          <platform name="unix64" char_bit="8" short_bit="16" int_bit="32" long_bit="64" long_long_bit="64" pointer_bit="64"/>
          <rawtokens>
            <file index="0" name="main.c"/>
            <tok fileIndex="0" str="int" linenr="1" column="1"/>
            <tok fileIndex="0" str="x" linenr="1" column="5"/>
            <tok fileIndex="0" str=";" linenr="1" column="6"/>
          </rawtokens>
          <suppressions>
            <suppression errorId="unusedVariable" fileName="main.c" lineNumber="1"/>
          </suppressions>
          <dump cfg="">
            <standards>
              <c version="c11"/>
              <cpp version="c++17"/>
            </standards>
            <tokenlist>
              <token id="t1" file="main.c" linenr="1" column="1" str="int" scope="s1" type="name" isUnsigned="false" isSigned="false" link="0" astParent="0"/>
              <token id="t2" file="main.c" linenr="1" column="5" str="x" scope="s1" type="name" varId="1" variable="v1" link="0" astParent="0"/>
              <token id="t3" file="main.c" linenr="1" column="6" str=";" scope="s1" type="op" link="0" astParent="0"/>
            </tokenlist>
            <scopes>
              <scope id="s1" type="Global" className="" nestedIn="0">
                <varlist>
                  <var id="v1"/>
                </varlist>
              </scope>
            </scopes>
            <variables>
              <var id="v1" nameToken="t2" typeStartToken="t1" typeEndToken="t1" access="Global" scope="s1" constness="0" isArray="false" isClass="false" isConst="false" isExtern="false" isPointer="false" isReference="false" isStatic="false" isVolatile="false"/>
            </variables>
          </dump>
        </dumps>
        """;

    @TempDir
    protected Path tempDir;

    protected StringWriter out;
    protected StringWriter err;

    @BeforeEach
    void setUpWriters() {
        out = new StringWriter();
        err = new StringWriter();
    }

    /**
     * Writes a dump file into the temporary directory.
     */
    protected Path createDump(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content);
        return file;
    }

    /**
     * Runs the CLI with the given arguments, capturing both streams.
     *
     * @return the exit code
     */
    protected int run(String... args) {
        CommandLine commandLine = new CommandLine(new DumpGraphCLI());
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
        return commandLine.execute(args);
    }

    /**
     * Path of a configuration file that does not exist, so defaults apply.
     */
    protected String noConfig() {
        return tempDir.resolve("absent.yaml").toString();
    }
}
