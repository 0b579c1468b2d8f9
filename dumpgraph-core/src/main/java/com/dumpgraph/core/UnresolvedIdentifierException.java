package com.dumpgraph.core;

/**
 * Thrown when an attribute carries an identifier that no record in the configuration
 * was issued with.
 *
 * <p>Reserved zero identifiers never raise this; they resolve to {@code null}. A missing
 * identifier means the dump is corrupt or was written by an unsupported analyzer version.
 */
public class UnresolvedIdentifierException extends DumpFormatException {

    private static final long serialVersionUID = 1L;

    private final String identifier;
    private final String expectedKind;

    /**
     * Creates a new exception.
     *
     * @param identifier the identifier that was not found
     * @param expectedKind simple name of the record type the attribute refers to
     * @param owner the record holding the reference, used for the message
     */
    public UnresolvedIdentifierException(String identifier, String expectedKind, Object owner) {
        super("Unresolved identifier '" + identifier + "' (expected " + expectedKind
            + ") referenced from " + owner);
        this.identifier = identifier;
        this.expectedKind = expectedKind;
    }

    /**
     * Returns the identifier that could not be resolved.
     *
     * @return the identifier
     */
    public String getIdentifier() {
        return identifier;
    }

    /**
     * Returns the simple name of the record type the reference should have named.
     *
     * @return expected record kind
     */
    public String getExpectedKind() {
        return expectedKind;
    }
}
