package com.dumpgraph.core.model;

/**
 * Lexical classification of a token, from the {@code type} attribute.
 */
public enum TokenKind {
    /** Identifier or keyword */
    NAME,

    /** Numeric literal, see {@link NumberKind} */
    NUMBER,

    /** String literal */
    STRING,

    /** Character literal */
    CHAR,

    /** Operator, see {@link OperatorKind} */
    OP,

    /** No classification written by the analyzer */
    OTHER;

    /**
     * Maps a {@code type} attribute value to a kind.
     *
     * @param type attribute value, may be null
     * @return matching kind, or {@link #OTHER} for absent and unrecognized values
     */
    public static TokenKind fromAttribute(String type) {
        if (type == null) {
            return OTHER;
        }
        return switch (type) {
            case "name" -> NAME;
            case "number" -> NUMBER;
            case "string" -> STRING;
            case "char" -> CHAR;
            case "op" -> OP;
            default -> OTHER;
        };
    }
}
