package com.dumpgraph.core.model;

import java.util.Objects;

/**
 * A finding raised by a checker against a resolved configuration.
 *
 * <p>This is only the key checkers agree on. Rendering it as a structured record or as a
 * human-readable line is up to the caller.
 *
 * @param file file of the location
 * @param line line of the location
 * @param column column of the location, 0 if unknown
 * @param severity severity
 * @param message human-readable message
 * @param addon name of the checker that raised it
 * @param ruleId checker-specific rule id
 */
public record Diagnostic(
    String file,
    int line,
    int column,
    Severity severity,
    String message,
    String addon,
    String ruleId
) {
    /**
     * Compact constructor with validation.
     */
    public Diagnostic {
        Objects.requireNonNull(severity, "severity must not be null");
        Objects.requireNonNull(message, "message must not be null");
        Objects.requireNonNull(ruleId, "ruleId must not be null");
    }

    /**
     * Creates a diagnostic positioned at a token or directive.
     *
     * @param location token or directive the finding refers to
     * @param severity severity
     * @param message message
     * @param addon checker name
     * @param ruleId rule id
     * @return new diagnostic
     */
    public static Diagnostic at(SourceLocation location, Severity severity, String message,
                                String addon, String ruleId) {
        Objects.requireNonNull(location, "location must not be null");
        return new Diagnostic(location.file(), location.line(), location.column(),
            severity, message, addon, ruleId);
    }
}
