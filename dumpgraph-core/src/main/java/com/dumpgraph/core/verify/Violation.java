package com.dumpgraph.core.verify;

import java.util.Objects;

/**
 * A broken structural invariant found in a resolved configuration.
 *
 * @param rule the invariant that does not hold
 * @param message human-readable description naming the offending record
 */
public record Violation(
    ViolationRule rule,
    String message
) {
    /**
     * Compact constructor with validation.
     */
    public Violation {
        Objects.requireNonNull(rule, "rule must not be null");
        Objects.requireNonNull(message, "message must not be null");
    }

    @Override
    public String toString() {
        return rule + ": " + message;
    }
}
