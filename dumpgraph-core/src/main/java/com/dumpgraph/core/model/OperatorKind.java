package com.dumpgraph.core.model;

/**
 * Sub-classification of operator tokens.
 */
public enum OperatorKind {
    ARITHMETICAL,
    ASSIGNMENT,
    COMPARISON,
    LOGICAL,
    /** Operator of no listed category, or not an operator */
    NONE
}
