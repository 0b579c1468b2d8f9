package com.dumpgraph.core.parser.builder;

import com.dumpgraph.core.DumpFormatException;
import com.dumpgraph.core.DumpTestBase;
import com.dumpgraph.core.model.NumberKind;
import com.dumpgraph.core.model.OperatorKind;
import com.dumpgraph.core.model.Token;
import com.dumpgraph.core.model.TokenKind;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link TokenRecordBuilder}.
 */
class TokenRecordBuilderTest extends DumpTestBase {

    private final TokenRecordBuilder builder = new TokenRecordBuilder();

    @Test
    void build_nameToken_readsFieldsAndKeepsRelationsAsIdentifiers() {
        Token token = builder.build(attributes("token",
            "id", "t2", "str", "count", "type", "name", "isUnsigned", "true",
            "file", "main.c", "linenr", "12", "column", "7", "varId", "4",
            "scope", "s1", "variable", "v1", "astParent", "t3", "link", "0", "values", "00000000"));

        assertThat(token.id()).isEqualTo("t2");
        assertThat(token.str()).isEqualTo("count");
        assertThat(token.isName()).isTrue();
        assertThat(token.isUnsigned()).isTrue();
        assertThat(token.isSigned()).isFalse();
        assertThat(token.file()).isEqualTo("main.c");
        assertThat(token.line()).isEqualTo(12);
        assertThat(token.column()).isEqualTo(7);
        assertThat(token.varId()).isEqualTo(4);
        assertThat(token.scopeId()).isEqualTo("s1");
        assertThat(token.variableId()).isEqualTo("v1");
        assertThat(token.astParentId()).isEqualTo("t3");
        assertThat(token.linkId()).isNull();
        assertThat(token.valuesId()).isNull();
        assertThat(token.variable()).isNull();
    }

    @Test
    void build_numberToken_readsNumberKind() {
        Token integer = builder.build(attributes("token",
            "id", "t1", "str", "42", "type", "number", "isInt", "true", "linenr", "1", "column", "1"));
        Token floating = builder.build(attributes("token",
            "id", "t2", "str", "1.5", "type", "number", "isFloat", "true", "linenr", "1", "column", "4"));

        assertThat(integer.numberKind()).isEqualTo(NumberKind.INT);
        assertThat(integer.isInt()).isTrue();
        assertThat(floating.numberKind()).isEqualTo(NumberKind.FLOAT);
        assertThat(floating.isFloat()).isTrue();
    }

    @Test
    void build_stringToken_requiresStrlen() {
        Token token = builder.build(attributes("token",
            "id", "t1", "str", "\"abc\"", "type", "string", "strlen", "3", "linenr", "1", "column", "1"));

        assertThat(token.isString()).isTrue();
        assertThat(token.strlen()).isEqualTo(3);

        assertThatThrownBy(() -> builder.build(attributes("token",
            "id", "t2", "str", "\"abc\"", "type", "string", "linenr", "1", "column", "1")))
            .isInstanceOf(DumpFormatException.class)
            .hasMessageContaining("strlen");
    }

    @Test
    void build_operatorToken_takesFirstOperatorFlag() {
        Token assignment = builder.build(attributes("token",
            "id", "t1", "str", "+=", "type", "op", "isAssignmentOp", "true", "linenr", "1", "column", "1"));
        Token comparison = builder.build(attributes("token",
            "id", "t2", "str", "<", "type", "op", "isComparisonOp", "true", "linenr", "1", "column", "3"));
        Token plain = builder.build(attributes("token",
            "id", "t3", "str", ",", "type", "op", "linenr", "1", "column", "5"));

        assertThat(assignment.operatorKind()).isEqualTo(OperatorKind.ASSIGNMENT);
        assertThat(assignment.isAssignmentOp()).isTrue();
        assertThat(comparison.isComparisonOp()).isTrue();
        assertThat(plain.isOp()).isTrue();
        assertThat(plain.operatorKind()).isEqualTo(OperatorKind.NONE);
    }

    @Test
    void build_untypedToken_isOther() {
        Token token = builder.build(attributes("token", "id", "t1", "str", "{", "linenr", "1", "column", "1"));

        assertThat(token.kind()).isEqualTo(TokenKind.OTHER);
        assertThat(token.isName()).isFalse();
        assertThat(token.isOp()).isFalse();
    }

    @Test
    void build_valueTypeAttributes_attachPromotedType() {
        Token token = builder.build(attributes("token",
            "id", "t1", "str", "x", "type", "name", "linenr", "1", "column", "1",
            "valueType-type", "int", "valueType-sign", "unsigned", "valueType-pointer", "1",
            "valueType-originalTypeName", "uint32_t", "valueType-typeScope", "0"));

        assertThat(token.valueType()).isNotNull();
        assertThat(token.valueType().type()).isEqualTo("int");
        assertThat(token.valueType().isUnsigned()).isTrue();
        assertThat(token.valueType().pointer()).isEqualTo(1);
        assertThat(token.valueType().originalTypeName()).isEqualTo("uint32_t");
    }

    @Test
    void build_withoutValueType_hasNone() {
        Token token = builder.build(attributes("token", "id", "t1", "str", ";", "linenr", "1", "column", "1"));

        assertThat(token.valueType()).isNull();
    }

    @Test
    void build_nonNumericLine_throwsDumpFormatException() {
        assertThatThrownBy(() -> builder.build(attributes("token",
            "id", "t1", "str", "x", "linenr", "one", "column", "1")))
            .isInstanceOf(DumpFormatException.class)
            .hasMessageContaining("linenr");
    }
}
