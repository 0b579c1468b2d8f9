package com.dumpgraph.core.parser.builder;

import com.dumpgraph.core.model.Function;
import com.dumpgraph.core.stream.ElementAttributes;

/**
 * Builds functions from {@code functionList/function} elements. Arguments are added
 * afterwards from the nested {@code arg} elements.
 */
public class FunctionRecordBuilder implements RecordBuilder<Function> {

    public static final String TAG = "function";

    @Override
    public String tag() {
        return TAG;
    }

    @Override
    public Function build(ElementAttributes attributes) {
        return new Function(
            attributes.require("id"),
            attributes.get("name"),
            attributes.get("type"),
            attributes.flag("isVirtual"),
            attributes.flag("isImplicitlyVirtual"),
            attributes.flag("isStatic"),
            attributes.reference("tokenDef"));
    }
}
