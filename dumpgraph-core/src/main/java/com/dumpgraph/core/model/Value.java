package com.dumpgraph.core.model;

import java.util.Objects;

/**
 * One possible runtime value of a token.
 *
 * <p>A value carries at most one payload, see {@link #payload()}. A token payload is
 * resolved to the token it names; the other payloads are plain numbers. A value with
 * payload {@link ValuePayload#NONE} returns null from every payload accessor.
 */
public final class Value implements Resolvable {

    private final ValuePayload payload;
    private final Long intValue;
    private final String tokValueId;
    private final Double floatValue;
    private final Long containerSize;
    private final Integer conditionLine;
    private final ValueKind kind;
    private final boolean inconclusive;

    private Token tokValue;

    private Value(ValuePayload payload, Long intValue, String tokValueId, Double floatValue,
                  Long containerSize, Integer conditionLine, ValueKind kind, boolean inconclusive) {
        this.payload = Objects.requireNonNull(payload, "payload must not be null");
        this.intValue = intValue;
        this.tokValueId = tokValueId;
        this.floatValue = floatValue;
        this.containerSize = containerSize;
        this.conditionLine = conditionLine;
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.inconclusive = inconclusive;
    }

    /**
     * Creates an integer value.
     *
     * @param value the integer
     * @param kind known, possible or unspecified
     * @param inconclusive whether the analyzer marked it inconclusive
     * @param conditionLine line of the condition the value comes from, or null
     * @return new value
     */
    public static Value ofInt(long value, ValueKind kind, boolean inconclusive, Integer conditionLine) {
        return new Value(ValuePayload.INTEGER, value, null, null, null, conditionLine, kind, inconclusive);
    }

    /**
     * Creates a value pointing at a token, resolved later.
     *
     * @param tokenId identifier of the token
     * @param kind known, possible or unspecified
     * @param inconclusive whether the analyzer marked it inconclusive
     * @param conditionLine line of the condition the value comes from, or null
     * @return new value
     */
    public static Value ofToken(String tokenId, ValueKind kind, boolean inconclusive, Integer conditionLine) {
        Objects.requireNonNull(tokenId, "tokenId must not be null");
        return new Value(ValuePayload.TOKEN, null, tokenId, null, null, conditionLine, kind, inconclusive);
    }

    /**
     * Creates a floating-point value.
     *
     * @param value the number
     * @param kind known, possible or unspecified
     * @param inconclusive whether the analyzer marked it inconclusive
     * @param conditionLine line of the condition the value comes from, or null
     * @return new value
     */
    public static Value ofFloat(double value, ValueKind kind, boolean inconclusive, Integer conditionLine) {
        return new Value(ValuePayload.FLOAT, null, null, value, null, conditionLine, kind, inconclusive);
    }

    /**
     * Creates a container-size value.
     *
     * @param size number of elements
     * @param kind known, possible or unspecified
     * @param inconclusive whether the analyzer marked it inconclusive
     * @param conditionLine line of the condition the value comes from, or null
     * @return new value
     */
    public static Value ofContainerSize(long size, ValueKind kind, boolean inconclusive, Integer conditionLine) {
        return new Value(ValuePayload.CONTAINER_SIZE, null, null, null, size, conditionLine, kind, inconclusive);
    }

    /**
     * Creates a value without a payload, such as an uninitialized or moved-from state.
     *
     * @param kind known, possible or unspecified
     * @param inconclusive whether the analyzer marked it inconclusive
     * @param conditionLine line of the condition the value comes from, or null
     * @return new value
     */
    public static Value withoutPayload(ValueKind kind, boolean inconclusive, Integer conditionLine) {
        return new Value(ValuePayload.NONE, null, null, null, null, conditionLine, kind, inconclusive);
    }

    @Override
    public void resolve(IdTable ids) {
        this.tokValue = ids.lookup(tokValueId, Token.class, this);
    }

    public ValuePayload payload() {
        return payload;
    }

    /**
     * Returns the integer payload.
     *
     * @return the integer, or null if this value carries another payload
     */
    public Long intValue() {
        return intValue;
    }

    public String tokValueId() {
        return tokValueId;
    }

    /**
     * Returns the token payload, available after resolution.
     *
     * @return the token, or null if this value carries another payload
     */
    public Token tokValue() {
        return tokValue;
    }

    public Double floatValue() {
        return floatValue;
    }

    public Long containerSize() {
        return containerSize;
    }

    /**
     * Returns the source line of the condition this value was derived from.
     *
     * @return line number, or null
     */
    public Integer conditionLine() {
        return conditionLine;
    }

    public ValueKind kind() {
        return kind;
    }

    public boolean isKnown() {
        return kind == ValueKind.KNOWN;
    }

    public boolean isPossible() {
        return kind == ValueKind.POSSIBLE;
    }

    public boolean isInconclusive() {
        return inconclusive;
    }

    @Override
    public String toString() {
        String text = switch (payload) {
            case INTEGER -> String.valueOf(intValue);
            case TOKEN -> "token " + tokValueId;
            case FLOAT -> String.valueOf(floatValue);
            case CONTAINER_SIZE -> "size " + containerSize;
            case NONE -> "no payload";
        };
        return "Value{" + text + ", " + kind + (inconclusive ? ", inconclusive" : "") + "}";
    }
}
