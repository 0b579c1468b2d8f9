package com.dumpgraph.core.model;

/**
 * Sub-classification of numeric literal tokens.
 */
public enum NumberKind {
    INT,
    FLOAT,
    /** Not a number, or a number the analyzer did not classify */
    NONE
}
