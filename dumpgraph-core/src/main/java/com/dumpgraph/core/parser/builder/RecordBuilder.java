package com.dumpgraph.core.parser.builder;

import com.dumpgraph.core.stream.ElementAttributes;

/**
 * Turns the attributes of one element into a typed record.
 *
 * <p>Builders read only the element at hand. Non-relational attributes are parsed into
 * their declared types; relational attributes stay identifier strings (null for absent
 * and reserved zero identifiers) until the owning configuration is resolved, because
 * many of them point forward in the document.
 *
 * @param <T> record type produced
 */
public interface RecordBuilder<T> {

    /**
     * Returns the element name this builder handles.
     *
     * @return element tag
     */
    String tag();

    /**
     * Builds a record from an element's attributes.
     *
     * @param attributes attributes of the element
     * @return the record
     * @throws com.dumpgraph.core.DumpFormatException if a required attribute is missing or a number does not parse
     */
    T build(ElementAttributes attributes);
}
