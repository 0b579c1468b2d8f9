package com.dumpgraph.core.stream;

import com.dumpgraph.core.DumpFormatException;
import com.dumpgraph.core.DumpTestBase;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link ElementAttributes}.
 */
class ElementAttributesTest extends DumpTestBase {

    @Test
    void require_missingAttribute_throwsWithTagAndLine() {
        ElementAttributes attrs = attributes("token", "id", "t1");

        assertThatThrownBy(() -> attrs.require("str"))
            .isInstanceOf(DumpFormatException.class)
            .hasMessageContaining("'str'")
            .hasMessageContaining("<token>")
            .hasMessageContaining("line 1");
    }

    @Test
    void reference_reservedZeroSpellings_areNull() {
        ElementAttributes attrs = attributes("token",
            "narrow", "0", "medium", "00000000", "wide", "0000000000000000", "real", "55d0a1");

        assertThat(attrs.reference("narrow")).isNull();
        assertThat(attrs.reference("medium")).isNull();
        assertThat(attrs.reference("wide")).isNull();
        assertThat(attrs.reference("absent")).isNull();
        assertThat(attrs.reference("real")).isEqualTo("55d0a1");
    }

    @Test
    void flag_trueAbsentAndFalse_areReadAsSetOrClear() {
        ElementAttributes attrs = attributes("var", "isConst", "true", "isStatic", "false", "isLocal", "");

        assertThat(attrs.flag("isConst")).isTrue();
        assertThat(attrs.flag("isStatic")).isFalse();
        assertThat(attrs.flag("isLocal")).isFalse();
        assertThat(attrs.flag("isPointer")).isFalse();
    }

    @Test
    void requireInt_notANumber_throwsDumpFormatException() {
        ElementAttributes attrs = attributes("token", "linenr", "twelve");

        assertThatThrownBy(() -> attrs.requireInt("linenr"))
            .isInstanceOf(DumpFormatException.class)
            .hasMessageContaining("'linenr'")
            .hasMessageContaining("twelve")
            .hasCauseInstanceOf(NumberFormatException.class);
    }

    @Test
    void optionalNumbers_absentOrEmpty_areNull() {
        ElementAttributes attrs = attributes("value", "intvalue", "");

        assertThat(attrs.optionalInt("intvalue")).isNull();
        assertThat(attrs.optionalLong("intvalue")).isNull();
        assertThat(attrs.optionalDouble("floatvalue")).isNull();
        assertThat(attrs.intOrDefault("constness", 3)).isEqualTo(3);
    }

    @Test
    void optionalNumbers_present_areParsed() {
        ElementAttributes attrs = attributes("value",
            "intvalue", "-9223372036854775808", "floatvalue", "2.5e3", "condition-line", "17");

        assertThat(attrs.optionalLong("intvalue")).isEqualTo(Long.MIN_VALUE);
        assertThat(attrs.optionalDouble("floatvalue")).isEqualTo(2500.0);
        assertThat(attrs.optionalInt("condition-line")).isEqualTo(17);
    }

    @Test
    void optionalDouble_malformed_throwsDumpFormatException() {
        ElementAttributes attrs = attributes("value", "floatvalue", "1.2.3");

        assertThatThrownBy(() -> attrs.optionalDouble("floatvalue"))
            .isInstanceOf(DumpFormatException.class);
    }
}
