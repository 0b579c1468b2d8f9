package com.dumpgraph.core.model;

import java.util.Objects;

/**
 * A preprocessor directive.
 *
 * <p>The analyzer strips C and C++ comments from the directive text. Directives have no
 * column information, so {@link #column()} is always 0.
 *
 * @param str directive line without comments, e.g. {@code #define X 1}
 * @param file name of the (possibly included) file holding the directive
 * @param line line number in that file
 */
public record Directive(
    String str,
    String file,
    int line
) implements SourceLocation {

    /**
     * Compact constructor with validation.
     */
    public Directive {
        Objects.requireNonNull(str, "str must not be null");
        Objects.requireNonNull(file, "file must not be null");
    }

    @Override
    public int column() {
        return 0;
    }
}
