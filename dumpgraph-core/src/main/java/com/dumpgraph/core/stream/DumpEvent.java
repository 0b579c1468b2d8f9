package com.dumpgraph.core.stream;

import java.util.Objects;

/**
 * One element boundary of a dump document.
 *
 * @param type enter or exit
 * @param tag element name
 * @param attributes attributes of the element; empty for exit events
 */
public record DumpEvent(
    DumpEventType type,
    String tag,
    ElementAttributes attributes
) {
    /**
     * Compact constructor with validation.
     */
    public DumpEvent {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(tag, "tag must not be null");
        Objects.requireNonNull(attributes, "attributes must not be null");
    }

    /**
     * Creates an enter event.
     *
     * @param attributes attributes of the element, carrying its tag
     * @return new event
     */
    public static DumpEvent enter(ElementAttributes attributes) {
        return new DumpEvent(DumpEventType.ENTER, attributes.tag(), attributes);
    }

    /**
     * Creates an exit event.
     *
     * @param tag element name
     * @param line source line of the end tag
     * @return new event
     */
    public static DumpEvent exit(String tag, int line) {
        return new DumpEvent(DumpEventType.EXIT, tag, ElementAttributes.empty(tag, line));
    }

    public boolean isEnter() {
        return type == DumpEventType.ENTER;
    }

    public boolean isExit() {
        return type == DumpEventType.EXIT;
    }

    /**
     * Returns the source line of the element boundary.
     *
     * @return line number, or -1 if unknown
     */
    public int line() {
        return attributes.line();
    }
}
