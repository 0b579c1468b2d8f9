package com.dumpgraph.core.parser.builder;

import com.dumpgraph.core.model.Suppression;
import com.dumpgraph.core.stream.ElementAttributes;

/**
 * Builds suppression rules from {@code suppressions/suppression} elements.
 */
public class SuppressionRecordBuilder implements RecordBuilder<Suppression> {

    public static final String TAG = "suppression";

    @Override
    public String tag() {
        return TAG;
    }

    @Override
    public Suppression build(ElementAttributes attributes) {
        return new Suppression(
            attributes.require("errorId"),
            attributes.get("fileName"),
            attributes.optionalInt("lineNumber"),
            attributes.get("symbolName"));
    }
}
