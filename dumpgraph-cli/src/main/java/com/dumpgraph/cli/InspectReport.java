package com.dumpgraph.cli;

import com.dumpgraph.core.model.Configuration;
import com.dumpgraph.core.model.Platform;
import com.dumpgraph.core.model.Standards;
import com.dumpgraph.core.parser.DumpDocument;

import java.util.List;

/**
 * Summary of a dump printed by {@code inspect}, serialized by Jackson for {@code --json}.
 *
 * @param source dump path
 * @param platform platform model, or null
 * @param files raw token file table
 * @param rawTokens number of raw tokens
 * @param suppressions number of suppression rules
 * @param configurations per-configuration summaries in document order
 */
public record InspectReport(
    String source,
    Platform platform,
    List<String> files,
    int rawTokens,
    int suppressions,
    List<ConfigurationSummary> configurations
) {
    /**
     * Record counts of one configuration.
     *
     * @param name configuration name, empty for the default configuration
     * @param standards language standards, or null
     * @param directives number of directives
     * @param tokens number of tokens
     * @param scopes number of scopes
     * @param functions number of functions
     * @param variables number of declared variables
     * @param argumentVariables number of argument variables without a name token
     * @param valueFlows number of value lists
     */
    public record ConfigurationSummary(
        String name,
        Standards standards,
        int directives,
        int tokens,
        int scopes,
        int functions,
        int variables,
        int argumentVariables,
        int valueFlows
    ) {
        static ConfigurationSummary of(Configuration configuration) {
            return new ConfigurationSummary(
                configuration.name(),
                configuration.standards(),
                configuration.directives().size(),
                configuration.tokens().size(),
                configuration.scopes().size(),
                configuration.functions().size(),
                configuration.variables().size(),
                configuration.argumentVariables().size(),
                configuration.valueFlows().size());
        }
    }

    static InspectReport of(DumpDocument document, List<ConfigurationSummary> configurations) {
        return new InspectReport(
            document.source().toString(),
            document.platform(),
            document.files(),
            document.rawTokens().size(),
            document.suppressions().size(),
            configurations);
    }
}
