package com.dumpgraph.core.stream;

import com.dumpgraph.core.DumpFormatException;
import com.dumpgraph.core.model.Identifiers;

import java.util.Map;
import java.util.Objects;

/**
 * Attributes of one element, copied out of the parser when the element starts.
 *
 * <p>Typed accessors turn parse failures into {@link DumpFormatException}s naming the
 * element, the attribute and the source line. Relational attributes are read through
 * {@link #reference(String)}, which maps reserved zero identifiers to {@code null}.
 */
public final class ElementAttributes {

    private final String tag;
    private final int line;
    private final Map<String, String> values;

    private ElementAttributes(String tag, int line, Map<String, String> values) {
        this.tag = Objects.requireNonNull(tag, "tag must not be null");
        this.line = line;
        this.values = values;
    }

    /**
     * Creates attributes for an element.
     *
     * @param tag element name
     * @param line source line of the start tag, -1 if unknown
     * @param values attribute values by local name
     * @return new attributes
     */
    public static ElementAttributes of(String tag, int line, Map<String, String> values) {
        return new ElementAttributes(tag, line, Map.copyOf(values));
    }

    /**
     * Creates attributes for an element without a known source line.
     *
     * @param tag element name
     * @param values attribute values by local name
     * @return new attributes
     */
    public static ElementAttributes of(String tag, Map<String, String> values) {
        return of(tag, -1, values);
    }

    static ElementAttributes empty(String tag, int line) {
        return new ElementAttributes(tag, line, Map.of());
    }

    public String tag() {
        return tag;
    }

    public int line() {
        return line;
    }

    /**
     * Returns an attribute value.
     *
     * @param name attribute name
     * @return value, or null if absent
     */
    public String get(String name) {
        return values.get(name);
    }

    /**
     * Returns a required attribute value.
     *
     * @param name attribute name
     * @return value
     * @throws DumpFormatException if absent
     */
    public String require(String name) {
        String value = values.get(name);
        if (value == null) {
            throw new DumpFormatException("Missing attribute '" + name + "' on " + describe());
        }
        return value;
    }

    /**
     * Returns a relational attribute with reserved zero identifiers mapped to null.
     *
     * @param name attribute name
     * @return identifier, or null if absent or reserved
     */
    public String reference(String name) {
        return Identifiers.normalize(values.get(name));
    }

    /**
     * Returns whether a flag attribute is set. The analyzer writes {@code "true"} for set
     * flags and omits clear ones; an explicit {@code "false"} also counts as clear.
     *
     * @param name attribute name
     * @return true if present, non-empty and not {@code "false"}
     */
    public boolean flag(String name) {
        String value = values.get(name);
        return value != null && !value.isEmpty() && !"false".equals(value);
    }

    /**
     * Returns a required integer attribute.
     *
     * @param name attribute name
     * @return parsed value
     * @throws DumpFormatException if absent or not an integer
     */
    public int requireInt(String name) {
        return parseInt(name, require(name));
    }

    /**
     * Returns an optional integer attribute.
     *
     * @param name attribute name
     * @return parsed value, or null if absent or empty
     * @throws DumpFormatException if present and not an integer
     */
    public Integer optionalInt(String name) {
        String value = values.get(name);
        if (value == null || value.isEmpty()) {
            return null;
        }
        return parseInt(name, value);
    }

    /**
     * Returns an optional integer attribute, or a default.
     *
     * @param name attribute name
     * @param defaultValue value to return if absent or empty
     * @return parsed value or default
     * @throws DumpFormatException if present and not an integer
     */
    public int intOrDefault(String name, int defaultValue) {
        Integer value = optionalInt(name);
        return value != null ? value : defaultValue;
    }

    /**
     * Returns an optional 64-bit integer attribute.
     *
     * @param name attribute name
     * @return parsed value, or null if absent or empty
     * @throws DumpFormatException if present and not an integer
     */
    public Long optionalLong(String name) {
        String value = values.get(name);
        if (value == null || value.isEmpty()) {
            return null;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw notANumber(name, value, e);
        }
    }

    /**
     * Returns an optional floating-point attribute.
     *
     * @param name attribute name
     * @return parsed value, or null if absent or empty
     * @throws DumpFormatException if present and not a number
     */
    public Double optionalDouble(String name) {
        String value = values.get(name);
        if (value == null || value.isEmpty()) {
            return null;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw notANumber(name, value, e);
        }
    }

    private int parseInt(String name, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw notANumber(name, value, e);
        }
    }

    private DumpFormatException notANumber(String name, String value, NumberFormatException cause) {
        return new DumpFormatException("Attribute '" + name + "' on " + describe()
            + " is not a number: '" + value + "'", cause);
    }

    private String describe() {
        return "<" + tag + ">" + (line > 0 ? " at line " + line : "");
    }

    @Override
    public String toString() {
        return describe() + " " + values;
    }
}
