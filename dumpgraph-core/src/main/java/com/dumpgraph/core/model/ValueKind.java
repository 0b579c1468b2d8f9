package com.dumpgraph.core.model;

/**
 * Certainty of a value-flow value.
 */
public enum ValueKind {
    /** The token always has this value */
    KNOWN,

    /** The token may have this value on some path */
    POSSIBLE,

    /** The analyzer wrote neither flag */
    UNSPECIFIED
}
