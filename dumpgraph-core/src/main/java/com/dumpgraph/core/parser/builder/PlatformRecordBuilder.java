package com.dumpgraph.core.parser.builder;

import com.dumpgraph.core.model.Platform;
import com.dumpgraph.core.stream.ElementAttributes;

/**
 * Builds the platform model from the document-level {@code platform} element.
 */
public class PlatformRecordBuilder implements RecordBuilder<Platform> {

    public static final String TAG = "platform";

    @Override
    public String tag() {
        return TAG;
    }

    @Override
    public Platform build(ElementAttributes attributes) {
        return new Platform(
            attributes.get("name"),
            attributes.requireInt("char_bit"),
            attributes.requireInt("short_bit"),
            attributes.requireInt("int_bit"),
            attributes.requireInt("long_bit"),
            attributes.requireInt("long_long_bit"),
            attributes.requireInt("pointer_bit"));
    }
}
