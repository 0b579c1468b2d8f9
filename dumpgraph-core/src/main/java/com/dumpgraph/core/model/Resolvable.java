package com.dumpgraph.core.model;

/**
 * A record whose relational fields are carried as identifier strings until the
 * configuration that owns it has been read completely.
 *
 * <p>{@link #resolve(IdTable)} replaces every identifier with the record it names.
 * Implementations read only their own raw identifiers, so calling it again with the
 * same table leaves the record unchanged.
 */
public interface Resolvable {

    /**
     * Rewrites this record's relational fields to direct references.
     *
     * @param ids lookup table of every record issued in the configuration
     * @throws com.dumpgraph.core.UnresolvedIdentifierException if an identifier is not in the table
     * @throws com.dumpgraph.core.DumpFormatException if an identifier names a record of the wrong kind
     */
    void resolve(IdTable ids);
}
