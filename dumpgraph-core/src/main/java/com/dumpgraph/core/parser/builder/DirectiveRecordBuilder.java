package com.dumpgraph.core.parser.builder;

import com.dumpgraph.core.model.Directive;
import com.dumpgraph.core.stream.ElementAttributes;

/**
 * Builds directives from {@code directivelist/directive} elements.
 */
public class DirectiveRecordBuilder implements RecordBuilder<Directive> {

    public static final String TAG = "directive";

    @Override
    public String tag() {
        return TAG;
    }

    @Override
    public Directive build(ElementAttributes attributes) {
        return new Directive(attributes.require("str"), attributes.require("file"), attributes.requireInt("linenr"));
    }
}
