package com.dumpgraph.core.stream;

/**
 * Kind of a stream event.
 */
public enum DumpEventType {
    /** An element starts; its attributes are available */
    ENTER,

    /** An element ends; it and its subtree have been released */
    EXIT
}
