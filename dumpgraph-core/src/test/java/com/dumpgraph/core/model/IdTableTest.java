package com.dumpgraph.core.model;

import com.dumpgraph.core.DumpFormatException;
import com.dumpgraph.core.UnresolvedIdentifierException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link IdTable}.
 */
class IdTableTest {

    private final IdTable ids = new IdTable();

    @Test
    void lookup_registeredIdentifier_returnsRecord() {
        Scope scope = new Scope("s1", "", "Global", null, null, null, null);
        ids.register("s1", scope);

        assertThat(ids.lookup("s1", Scope.class, "owner")).isSameAs(scope);
        assertThat(ids.size()).isEqualTo(1);
    }

    @Test
    void lookup_reservedOrAbsentIdentifier_returnsNullWithoutLookup() {
        assertThat(ids.lookup(null, Token.class, "owner")).isNull();
        assertThat(ids.lookup("0", Token.class, "owner")).isNull();
        assertThat(ids.lookup("0000000000000000", Token.class, "owner")).isNull();
    }

    @Test
    void lookup_unknownIdentifier_throwsUnresolvedIdentifierException() {
        assertThatThrownBy(() -> ids.lookup("t404", Token.class, "owner"))
            .isInstanceOf(UnresolvedIdentifierException.class)
            .hasMessageContaining("t404")
            .hasMessageContaining("Token")
            .satisfies(e -> {
                UnresolvedIdentifierException unresolved = (UnresolvedIdentifierException) e;
                assertThat(unresolved.getIdentifier()).isEqualTo("t404");
                assertThat(unresolved.getExpectedKind()).isEqualTo("Token");
            });
    }

    @Test
    void lookup_recordOfOtherKind_throwsDumpFormatException() {
        ids.register("f1", new Function("f1", "main", "Function", false, false, false, null));

        assertThatThrownBy(() -> ids.lookup("f1", Token.class, "owner"))
            .isInstanceOf(DumpFormatException.class)
            .isNotInstanceOf(UnresolvedIdentifierException.class)
            .hasMessageContaining("f1");
    }

    @Test
    void register_duplicateIdentifier_throwsDumpFormatException() {
        ids.register("x", new ValueFlow("x"));

        assertThatThrownBy(() -> ids.register("x", new ValueFlow("x")))
            .isInstanceOf(DumpFormatException.class)
            .hasMessageContaining("Duplicate");
    }

    @Test
    void register_reservedIdentifier_throwsDumpFormatException() {
        assertThatThrownBy(() -> ids.register("00000000", new ValueFlow("v")))
            .isInstanceOf(DumpFormatException.class);
    }
}
