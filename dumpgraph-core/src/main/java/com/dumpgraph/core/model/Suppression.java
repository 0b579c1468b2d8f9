package com.dumpgraph.core.model;

import java.util.Objects;

/**
 * A rule suppressing diagnostics.
 *
 * <p>Error id, file name and symbol name may hold wildcards; they are kept as written.
 * Matching a diagnostic against a suppression is left to the checker.
 *
 * @param errorId id of the diagnostic to suppress
 * @param fileName file the suppression applies to, or null for any file
 * @param lineNumber line the suppression applies to, or null for any line
 * @param symbolName symbol the suppression applies to, or null for any symbol
 */
public record Suppression(
    String errorId,
    String fileName,
    Integer lineNumber,
    String symbolName
) {
    /**
     * Compact constructor with validation.
     */
    public Suppression {
        Objects.requireNonNull(errorId, "errorId must not be null");
    }
}
