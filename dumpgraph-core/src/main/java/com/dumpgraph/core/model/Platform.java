package com.dumpgraph.core.model;

/**
 * Numeric width model of the target ABI the dump was produced for.
 *
 * @param name platform name, e.g. {@code unix64}; may be null
 * @param charBit bits in a {@code char}
 * @param shortBit bits in a {@code short}
 * @param intBit bits in an {@code int}
 * @param longBit bits in a {@code long}
 * @param longLongBit bits in a {@code long long}
 * @param pointerBit bits in a data pointer
 */
public record Platform(
    String name,
    int charBit,
    int shortBit,
    int intBit,
    int longBit,
    int longLongBit,
    int pointerBit
) {
    /**
     * Returns the bit width of a standard integer type name.
     *
     * @param typeName one of {@code char}, {@code short}, {@code int}, {@code long}, {@code long long}
     * @return bit width, or 0 for other names
     */
    public int bitsOf(String typeName) {
        if (typeName == null) {
            return 0;
        }
        return switch (typeName) {
            case "char" -> charBit;
            case "short" -> shortBit;
            case "int" -> intBit;
            case "long" -> longBit;
            case "long long" -> longLongBit;
            default -> 0;
        };
    }
}
