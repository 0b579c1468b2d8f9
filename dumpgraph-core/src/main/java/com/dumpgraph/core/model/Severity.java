package com.dumpgraph.core.model;

import java.util.Locale;

/**
 * Diagnostic severities understood by the analyzer's report consumers.
 */
public enum Severity {
    ERROR,
    WARNING,
    STYLE,
    PERFORMANCE,
    PORTABILITY,
    INFORMATION;

    /**
     * Returns the lower-case spelling used in reports.
     *
     * @return report spelling, e.g. {@code "style"}
     */
    public String reportName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
