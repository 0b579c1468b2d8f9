package com.dumpgraph.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The possible values of one token, addressed by a single identifier.
 *
 * <p>Values are appended while the {@code values} element is read; tokens that name
 * this list share the same unmodifiable view.
 */
public final class ValueFlow {

    private final String id;
    private final List<Value> values = new ArrayList<>();
    private final List<Value> view = Collections.unmodifiableList(values);

    /**
     * Creates an empty value list.
     *
     * @param id identifier of the list
     */
    public ValueFlow(String id) {
        this.id = Objects.requireNonNull(id, "id must not be null");
    }

    /**
     * Appends a value in document order.
     *
     * @param value the value
     */
    public void add(Value value) {
        values.add(Objects.requireNonNull(value, "value must not be null"));
    }

    public String id() {
        return id;
    }

    public List<Value> values() {
        return view;
    }

    @Override
    public String toString() {
        return "ValueFlow{" + id + ", " + values.size() + " values}";
    }
}
