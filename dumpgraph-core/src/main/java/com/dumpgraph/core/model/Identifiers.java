package com.dumpgraph.core.model;

/**
 * Normalization of document identifiers.
 *
 * <p>The analyzer writes "no reference" in several ways: the attribute may be absent,
 * or it may hold a zero identifier whose width depends on how the dump was produced
 * ({@code 0}, {@code 00000000}, {@code 0000000000000000}). Every all-zero spelling is
 * treated as reserved so that code past this boundary tests a single {@code null}.
 */
public final class Identifiers {

    private Identifiers() {
        // Utility class
    }

    /**
     * Returns {@code true} if the identifier means "no reference".
     *
     * @param identifier raw attribute value, may be null
     * @return true for null and for any non-empty run of {@code '0'}
     */
    public static boolean isNull(String identifier) {
        if (identifier == null) {
            return true;
        }
        if (identifier.isEmpty()) {
            return false;
        }
        for (int i = 0; i < identifier.length(); i++) {
            if (identifier.charAt(i) != '0') {
                return false;
            }
        }
        return true;
    }

    /**
     * Maps reserved zero identifiers to {@code null} and returns every other value unchanged.
     *
     * @param identifier raw attribute value, may be null
     * @return the identifier, or null if it is reserved
     */
    public static String normalize(String identifier) {
        return isNull(identifier) ? null : identifier;
    }
}
