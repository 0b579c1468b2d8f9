package com.dumpgraph.core.parser.builder;

import com.dumpgraph.core.model.ValueFlow;
import com.dumpgraph.core.stream.ElementAttributes;

/**
 * Opens a value list from a {@code valueflow/values} element. Its values are added from
 * the nested {@code value} elements.
 */
public class ValueFlowRecordBuilder implements RecordBuilder<ValueFlow> {

    public static final String TAG = "values";

    @Override
    public String tag() {
        return TAG;
    }

    @Override
    public ValueFlow build(ElementAttributes attributes) {
        return new ValueFlow(attributes.require("id"));
    }
}
