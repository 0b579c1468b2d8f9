package com.dumpgraph.core.parser;

import com.dumpgraph.core.DumpFormatException;
import com.dumpgraph.core.DumpTestBase;
import com.dumpgraph.core.model.Token;
import com.dumpgraph.core.stream.DumpEventReader;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link DocumentRootParser}.
 */
class DocumentRootParserTest extends DumpTestBase {

    private final DocumentRootParser parser = new DocumentRootParser();

    private static final String FACTS = """
        <dumps>
          <platform name="unix64" char_bit="8" short_bit="16" int_bit="32" long_bit="64" long_long_bit="64" pointer_bit="64"/>
          <rawtokens>
            <file index="0" name="x.c"/>
            <file index="1" name="y.c"/>
            <tok fileIndex="0" linenr="1" column="1" str="a"/>
            <tok fileIndex="1" linenr="7" column="3" str="b"/>
            <tok fileIndex="1" linenr="7" column="4" str="c"/>
          </rawtokens>
          <suppressions>
            <suppression errorId="uninitvar" fileName="x.c" lineNumber="1"/>
          </suppressions>
          <dump cfg="">
            <tokenlist/>
          </dump>
        </dumps>
        """;

    @Test
    void scan_allFacts_readsPlatformRawTokensAndSuppressions() {
        DocumentFacts facts;
        try (DumpEventReader reader = reader(FACTS)) {
            facts = parser.scan(reader);
        }

        assertThat(facts.platform().name()).isEqualTo("unix64");
        assertThat(facts.platform().intBit()).isEqualTo(32);
        assertThat(facts.files()).containsExactly("x.c", "y.c");
        assertThat(facts.rawTokens()).extracting(Token::str).containsExactly("a", "b", "c");
        assertThat(facts.suppressions()).singleElement()
            .satisfies(s -> assertThat(s.errorId()).isEqualTo("uninitvar"));
    }

    @Test
    void scan_rawTokenFileIndex_selectsNameFromTable() {
        DocumentFacts facts;
        try (DumpEventReader reader = reader(FACTS)) {
            facts = parser.scan(reader);
        }

        Token b = facts.rawTokens().get(1);
        assertThat(b.file()).isEqualTo("y.c");
        assertThat(b.line()).isEqualTo(7);
        assertThat(b.column()).isEqualTo(3);
        assertThat(facts.rawTokens().get(0).file()).isEqualTo("x.c");
    }

    @Test
    void scan_rawTokens_areLinkedInTheirOwnSequence() {
        DocumentFacts facts;
        try (DumpEventReader reader = reader(FACTS)) {
            facts = parser.scan(reader);
        }

        Token first = facts.rawTokens().get(0);
        Token last = facts.rawTokens().get(2);
        assertThat(first.previous()).isNull();
        assertThat(first.next().next()).isSameAs(last);
        assertThat(last.next()).isNull();
        assertThat(last.previous().previous()).isSameAs(first);
    }

    @Test
    void scan_allFactsSeen_stopsBeforeConfigurations() {
        try (DumpEventReader reader = reader(FACTS)) {
            parser.scan(reader);

            assertThat(reader.hasNext()).isTrue();
            assertThat(reader.next().tag()).isEqualTo("dump");
        }
    }

    @Test
    void scan_missingFacts_readsToEndAndReturnsWhatWasFound() {
        String xml = "<dumps><rawtokens><file index=\"0\" name=\"only.c\"/></rawtokens><dump cfg=\"\"/></dumps>";

        DocumentFacts facts;
        try (DumpEventReader reader = reader(xml)) {
            facts = parser.scan(reader);
            assertThat(reader.hasNext()).isFalse();
        }

        assertThat(facts.platform()).isNull();
        assertThat(facts.files()).containsExactly("only.c");
        assertThat(facts.rawTokens()).isEmpty();
        assertThat(facts.suppressions()).isEmpty();
    }

    @Test
    void scan_fileIndexOutsideTable_throwsDumpFormatException() {
        String xml = "<dumps><rawtokens><file index=\"0\" name=\"x.c\"/>"
            + "<tok fileIndex=\"1\" linenr=\"1\" column=\"1\" str=\"a\"/></rawtokens></dumps>";

        try (DumpEventReader reader = reader(xml)) {
            assertThatThrownBy(() -> parser.scan(reader))
                .isInstanceOf(DumpFormatException.class)
                .hasMessageContaining("file index 1");
        }
    }
}
