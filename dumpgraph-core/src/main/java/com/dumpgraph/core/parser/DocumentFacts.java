package com.dumpgraph.core.parser;

import com.dumpgraph.core.model.Platform;
import com.dumpgraph.core.model.Suppression;
import com.dumpgraph.core.model.Token;

import java.util.List;

/**
 * Facts that live outside every configuration.
 *
 * @param platform numeric platform model, or null if the document has none
 * @param rawTokens raw tokens in document order, linked into their own sequence
 * @param files file table of the raw tokens, in index order
 * @param suppressions suppression rules
 */
public record DocumentFacts(
    Platform platform,
    List<Token> rawTokens,
    List<String> files,
    List<Suppression> suppressions
) {
    /**
     * Compact constructor with validation.
     */
    public DocumentFacts {
        rawTokens = rawTokens == null ? List.of() : List.copyOf(rawTokens);
        files = files == null ? List.of() : List.copyOf(files);
        suppressions = suppressions == null ? List.of() : List.copyOf(suppressions);
    }
}
