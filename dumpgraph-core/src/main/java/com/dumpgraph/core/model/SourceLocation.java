package com.dumpgraph.core.model;

/**
 * Position of a token or directive in the analyzed sources.
 */
public interface SourceLocation {

    /**
     * Returns the name of the (possibly included) file.
     *
     * @return file name
     */
    String file();

    /**
     * Returns the 1-based line number.
     *
     * @return line number
     */
    int line();

    /**
     * Returns the column, or 0 where the analyzer does not record one.
     *
     * @return column
     */
    int column();
}
