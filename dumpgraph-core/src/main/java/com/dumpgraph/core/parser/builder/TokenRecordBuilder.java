package com.dumpgraph.core.parser.builder;

import com.dumpgraph.core.model.NumberKind;
import com.dumpgraph.core.model.OperatorKind;
import com.dumpgraph.core.model.Token;
import com.dumpgraph.core.model.TokenKind;
import com.dumpgraph.core.model.ValueType;
import com.dumpgraph.core.stream.ElementAttributes;

/**
 * Builds configuration tokens from {@code token} elements.
 *
 * <p>Classification follows the {@code type} attribute; sub-kind flags are only read for
 * the matching type, and the first set operator flag wins. A promoted type is attached
 * when {@code valueType-type} is present.
 */
public class TokenRecordBuilder implements RecordBuilder<Token> {

    public static final String TAG = "token";

    @Override
    public String tag() {
        return TAG;
    }

    @Override
    public Token build(ElementAttributes attributes) {
        TokenKind kind = TokenKind.fromAttribute(attributes.get("type"));
        Token.Builder token = Token.builder()
            .id(attributes.require("id"))
            .str(attributes.require("str"))
            .kind(kind)
            .location(attributes.get("file"), attributes.requireInt("linenr"), attributes.requireInt("column"))
            .expandedMacro(attributes.flag("isExpandedMacro"))
            .varId(attributes.optionalInt("varId"))
            .valueType(valueType(attributes))
            .linkId(attributes.reference("link"))
            .scopeId(attributes.reference("scope"))
            .typeScopeId(attributes.reference("type-scope"))
            .variableId(attributes.reference("variable"))
            .functionId(attributes.reference("function"))
            .valuesId(attributes.reference("values"))
            .astParentId(attributes.reference("astParent"))
            .astOperand1Id(attributes.reference("astOperand1"))
            .astOperand2Id(attributes.reference("astOperand2"));

        switch (kind) {
            case NAME -> token
                .unsigned(attributes.flag("isUnsigned"))
                .signed(attributes.flag("isSigned"));
            case NUMBER -> token.numberKind(numberKind(attributes));
            case STRING -> token.strlen(attributes.requireInt("strlen"));
            case OP -> token.operatorKind(operatorKind(attributes));
            default -> {
                // char literals and unclassified tokens carry no sub-kind
            }
        }
        return token.build();
    }

    static NumberKind numberKind(ElementAttributes attributes) {
        if (attributes.flag("isInt")) {
            return NumberKind.INT;
        }
        if (attributes.flag("isFloat")) {
            return NumberKind.FLOAT;
        }
        return NumberKind.NONE;
    }

    static OperatorKind operatorKind(ElementAttributes attributes) {
        if (attributes.flag("isArithmeticalOp")) {
            return OperatorKind.ARITHMETICAL;
        }
        if (attributes.flag("isAssignmentOp")) {
            return OperatorKind.ASSIGNMENT;
        }
        if (attributes.flag("isComparisonOp")) {
            return OperatorKind.COMPARISON;
        }
        if (attributes.flag("isLogicalOp")) {
            return OperatorKind.LOGICAL;
        }
        return OperatorKind.NONE;
    }

    /**
     * Reads the {@code valueType-*} attributes of a token.
     *
     * @param attributes token attributes
     * @return the promoted type, or null if the token has none
     */
    static ValueType valueType(ElementAttributes attributes) {
        String type = attributes.get("valueType-type");
        if (type == null || type.isEmpty()) {
            return null;
        }
        return new ValueType(
            type,
            attributes.get("valueType-sign"),
            attributes.intOrDefault("valueType-bits", 0),
            attributes.intOrDefault("valueType-pointer", 0),
            attributes.intOrDefault("valueType-constness", 0),
            attributes.get("valueType-originalTypeName"),
            attributes.reference("valueType-typeScope"));
    }
}
