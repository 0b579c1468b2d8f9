package com.dumpgraph.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Settings for reading dump files.
 *
 * <p>Loaded from {@code dumpgraph.yaml}. Every setting is optional; missing sections fall
 * back to {@link #defaults()}.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * reader:
 *   maxElementDepth: 64
 *   maxAttributeSize: 1048576
 *   maxAttributesPerElement: 128
 *
 * verifyGraph: true
 * }</pre>
 *
 * @param reader limits applied by the XML stream reader
 * @param verifyGraph whether each configuration is checked against the graph invariants as it is yielded
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ParserConfig(
    @JsonProperty("reader") ReaderSettings reader,
    @JsonProperty("verifyGraph") boolean verifyGraph
) {
    /**
     * Compact constructor filling in missing sections.
     */
    public ParserConfig {
        if (reader == null) {
            reader = ReaderSettings.defaults();
        }
    }

    /**
     * Creates the default configuration: default reader limits, no verification.
     *
     * @return default configuration
     */
    public static ParserConfig defaults() {
        return new ParserConfig(ReaderSettings.defaults(), false);
    }

    /**
     * Limits enforced by the XML stream reader. A null limit keeps the default.
     *
     * @param maxElementDepth deepest element nesting accepted
     * @param maxAttributeSize longest attribute value accepted, in characters
     * @param maxAttributesPerElement most attributes accepted on one element
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ReaderSettings(
        @JsonProperty("maxElementDepth") Integer maxElementDepth,
        @JsonProperty("maxAttributeSize") Integer maxAttributeSize,
        @JsonProperty("maxAttributesPerElement") Integer maxAttributesPerElement
    ) {
        /** Dumps nest only a few levels below the document element */
        public static final int DEFAULT_MAX_ELEMENT_DEPTH = 64;

        /** Directive lines can be long after comment stripping and line splicing */
        public static final int DEFAULT_MAX_ATTRIBUTE_SIZE = 1_048_576;

        public static final int DEFAULT_MAX_ATTRIBUTES_PER_ELEMENT = 128;

        /**
         * Compact constructor filling in missing limits.
         */
        public ReaderSettings {
            if (maxElementDepth == null) {
                maxElementDepth = DEFAULT_MAX_ELEMENT_DEPTH;
            }
            if (maxAttributeSize == null) {
                maxAttributeSize = DEFAULT_MAX_ATTRIBUTE_SIZE;
            }
            if (maxAttributesPerElement == null) {
                maxAttributesPerElement = DEFAULT_MAX_ATTRIBUTES_PER_ELEMENT;
            }
        }

        /**
         * Creates the default limits.
         *
         * @return default reader settings
         */
        public static ReaderSettings defaults() {
            return new ReaderSettings(null, null, null);
        }
    }
}
