package com.dumpgraph.core.parser.builder;

import com.dumpgraph.core.model.Standards;
import com.dumpgraph.core.stream.ElementAttributes;

/**
 * Collects the children of a {@code standards} element: {@code c} and {@code cpp} carry a
 * {@code version} attribute, {@code posix} is present or not.
 */
public class StandardsAccumulator {

    public static final String TAG = "standards";

    private String c;
    private String cpp;
    private boolean posix;

    /**
     * Reads one child element of {@code standards}. Other tags are ignored.
     *
     * @param attributes child attributes
     */
    public void accept(ElementAttributes attributes) {
        switch (attributes.tag()) {
            case "c" -> c = attributes.require("version");
            case "cpp" -> cpp = attributes.require("version");
            case "posix" -> posix = true;
            default -> {
                // newer analyzers may list more standards
            }
        }
    }

    public Standards build() {
        return new Standards(c, cpp, posix);
    }
}
