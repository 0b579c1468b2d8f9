package com.dumpgraph.core.model;

/**
 * Access and storage classification of a variable, from the {@code access} attribute.
 */
public enum VariableAccess {
    GLOBAL("Global"),
    LOCAL("Local"),
    NAMESPACE("Namespace"),
    PUBLIC("Public"),
    PROTECTED("Protected"),
    PRIVATE("Private"),
    ARGUMENT("Argument"),
    THROW("Throw"),
    UNKNOWN("Unknown");

    private final String dumpName;

    VariableAccess(String dumpName) {
        this.dumpName = dumpName;
    }

    /**
     * Maps an {@code access} attribute value to a classification.
     *
     * @param name attribute value, may be null
     * @return matching classification, or {@link #UNKNOWN}
     */
    public static VariableAccess fromDumpName(String name) {
        if (name != null) {
            for (VariableAccess access : values()) {
                if (access.dumpName.equals(name)) {
                    return access;
                }
            }
        }
        return UNKNOWN;
    }
}
