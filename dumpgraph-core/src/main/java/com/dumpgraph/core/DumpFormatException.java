package com.dumpgraph.core;

/**
 * Thrown when a dump document does not have the structure the reader expects.
 *
 * <p>Covers malformed markup, an element in the wrong place, a missing required
 * attribute, an attribute that does not parse as a number, and an identifier that names a
 * record of the wrong kind. Dumps are produced by a trusted analyzer, so there is no
 * recovery: the exception aborts the document, or the configuration being resolved.
 *
 * @see UnresolvedIdentifierException
 */
public class DumpFormatException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates a new exception with a message.
     *
     * @param message the error message
     */
    public DumpFormatException(String message) {
        super(message);
    }

    /**
     * Creates a new exception with a message and cause.
     *
     * @param message the error message
     * @param cause the underlying cause
     */
    public DumpFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
