package com.dumpgraph.core.model;

import com.dumpgraph.core.DumpFormatException;
import com.dumpgraph.core.UnresolvedIdentifierException;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Identifier-to-record lookup table for one configuration.
 *
 * <p>The table is filled completely before any record is resolved, which is what makes
 * forward references safe: a token may name an AST parent that appears later in the
 * document. It is discarded once the configuration has been resolved.
 *
 * <p>Value lists are registered as {@link ValueFlow} entries and addressed as a unit.
 */
public final class IdTable {

    private final Map<String, Object> records = new HashMap<>();

    /**
     * Registers a record under its identifier.
     *
     * @param identifier identifier issued for the record
     * @param record the record
     * @throws DumpFormatException if the identifier is reserved or already names another record
     */
    public void register(String identifier, Object record) {
        Objects.requireNonNull(record, "record must not be null");
        if (Identifiers.isNull(identifier)) {
            throw new DumpFormatException("Record has no identifier: " + record);
        }
        Object previous = records.putIfAbsent(identifier, record);
        if (previous != null && previous != record) {
            throw new DumpFormatException("Duplicate identifier '" + identifier + "' issued for "
                + previous + " and " + record);
        }
    }

    /**
     * Looks up the record an identifier names.
     *
     * @param identifier identifier from an attribute; reserved and absent identifiers yield null
     * @param kind expected record type
     * @param owner record holding the reference, used in error messages
     * @param <T> expected record type
     * @return the record, or null for a reserved or absent identifier
     * @throws UnresolvedIdentifierException if the identifier is not in the table
     * @throws DumpFormatException if the identifier names a record of another kind
     */
    public <T> T lookup(String identifier, Class<T> kind, Object owner) {
        if (Identifiers.isNull(identifier)) {
            return null;
        }
        Object record = records.get(identifier);
        if (record == null) {
            throw new UnresolvedIdentifierException(identifier, kind.getSimpleName(), owner);
        }
        if (!kind.isInstance(record)) {
            throw new DumpFormatException("Identifier '" + identifier + "' referenced from " + owner
                + " names a " + record.getClass().getSimpleName() + ", expected " + kind.getSimpleName());
        }
        return kind.cast(record);
    }

    /**
     * Returns the number of registered identifiers.
     *
     * @return table size
     */
    public int size() {
        return records.size();
    }
}
