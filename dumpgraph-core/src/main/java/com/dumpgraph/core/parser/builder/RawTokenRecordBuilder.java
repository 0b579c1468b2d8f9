package com.dumpgraph.core.parser.builder;

import com.dumpgraph.core.stream.ElementAttributes;

/**
 * Builds raw token entries from {@code rawtokens/tok} elements.
 */
public class RawTokenRecordBuilder implements RecordBuilder<RawTokenEntry> {

    public static final String TAG = "tok";

    @Override
    public String tag() {
        return TAG;
    }

    @Override
    public RawTokenEntry build(ElementAttributes attributes) {
        return new RawTokenEntry(
            attributes.requireInt("fileIndex"),
            attributes.require("str"),
            attributes.requireInt("linenr"),
            attributes.requireInt("column"),
            attributes.line());
    }
}
