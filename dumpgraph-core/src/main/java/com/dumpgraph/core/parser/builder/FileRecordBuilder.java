package com.dumpgraph.core.parser.builder;

import com.dumpgraph.core.stream.ElementAttributes;

/**
 * Reads the file name from a {@code rawtokens/file} element.
 *
 * <p>Files are listed in index order; the {@code index} attribute is not consulted.
 */
public class FileRecordBuilder implements RecordBuilder<String> {

    public static final String TAG = "file";

    @Override
    public String tag() {
        return TAG;
    }

    @Override
    public String build(ElementAttributes attributes) {
        return attributes.require("name");
    }
}
