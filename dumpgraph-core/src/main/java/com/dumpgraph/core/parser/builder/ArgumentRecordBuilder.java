package com.dumpgraph.core.parser.builder;

import com.dumpgraph.core.stream.ElementAttributes;

/**
 * Builds argument entries from {@code function/arg} elements.
 */
public class ArgumentRecordBuilder implements RecordBuilder<FunctionArgument> {

    public static final String TAG = "arg";

    @Override
    public String tag() {
        return TAG;
    }

    @Override
    public FunctionArgument build(ElementAttributes attributes) {
        return new FunctionArgument(attributes.requireInt("nr"), attributes.reference("variable"));
    }
}
