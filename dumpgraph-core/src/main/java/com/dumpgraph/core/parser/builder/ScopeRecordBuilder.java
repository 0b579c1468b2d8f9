package com.dumpgraph.core.parser.builder;

import com.dumpgraph.core.model.Scope;
import com.dumpgraph.core.stream.ElementAttributes;

/**
 * Builds scopes from {@code scopes/scope} elements.
 */
public class ScopeRecordBuilder implements RecordBuilder<Scope> {

    public static final String TAG = "scope";

    @Override
    public String tag() {
        return TAG;
    }

    @Override
    public Scope build(ElementAttributes attributes) {
        return new Scope(
            attributes.require("id"),
            attributes.get("className"),
            attributes.get("type"),
            attributes.reference("bodyStart"),
            attributes.reference("bodyEnd"),
            attributes.reference("function"),
            attributes.reference("nestedIn"));
    }
}
