package com.dumpgraph.core.parser;

/**
 * Where a {@code var} element sits in the document.
 */
public enum VariableContext {
    /** Declarations of the configuration, outside any scope listing */
    DECLARATIONS,
    /** The informational {@code scope/varlist} listing */
    SCOPE_VARLIST
}
