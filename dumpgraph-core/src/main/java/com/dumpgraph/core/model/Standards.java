package com.dumpgraph.core.model;

/**
 * Language standards the analyzer assumed for one configuration.
 *
 * @param c C standard version, e.g. {@code c11}
 * @param cpp C++ standard version, e.g. {@code c++17}
 * @param posix whether POSIX was enabled
 */
public record Standards(
    String c,
    String cpp,
    boolean posix
) {}
