package com.dumpgraph.core.model;

/**
 * Which payload a {@link Value} carries. At most one is present per value.
 */
public enum ValuePayload {
    INTEGER,
    TOKEN,
    FLOAT,
    CONTAINER_SIZE,
    /** Uninitialized, moved and lifetime values carry no number or token */
    NONE
}
