package com.dumpgraph.core.model;

import java.util.List;
import java.util.Objects;

/**
 * One resolved analysis view of the translation unit, for one preprocessor branch.
 *
 * <p>All lists are in document order. Every relation inside the configuration has been
 * resolved; records do not reference records of other configurations.
 *
 * @param name configuration name, {@code ""} for the default configuration
 * @param standards language standards, or null if the dump has none for this configuration
 * @param directives preprocessor directives
 * @param tokens token list, linked through {@link Token#next()} / {@link Token#previous()}
 * @param scopes scopes
 * @param functions functions
 * @param variables variables declared with a name token
 * @param argumentVariables argument variables without a name token
 * @param valueFlows value lists attached to tokens
 */
public record Configuration(
    String name,
    Standards standards,
    List<Directive> directives,
    List<Token> tokens,
    List<Scope> scopes,
    List<Function> functions,
    List<Variable> variables,
    List<Variable> argumentVariables,
    List<ValueFlow> valueFlows
) {
    /**
     * Compact constructor with validation.
     */
    public Configuration {
        Objects.requireNonNull(name, "name must not be null");
        directives = directives == null ? List.of() : List.copyOf(directives);
        tokens = tokens == null ? List.of() : List.copyOf(tokens);
        scopes = scopes == null ? List.of() : List.copyOf(scopes);
        functions = functions == null ? List.of() : List.copyOf(functions);
        variables = variables == null ? List.of() : List.copyOf(variables);
        argumentVariables = argumentVariables == null ? List.of() : List.copyOf(argumentVariables);
        valueFlows = valueFlows == null ? List.of() : List.copyOf(valueFlows);
    }

    /**
     * Returns whether this is the default (unconditional) configuration.
     *
     * @return true if the name is empty
     */
    public boolean isDefault() {
        return name.isEmpty();
    }

    /**
     * Returns the root of the scope tree.
     *
     * @return the first global scope, or null if the configuration has none
     */
    public Scope globalScope() {
        for (Scope scope : scopes) {
            if (scope.type() == ScopeType.GLOBAL) {
                return scope;
            }
        }
        return null;
    }

    /**
     * Returns the first token of the token list.
     *
     * @return first token, or null for an empty token list
     */
    public Token firstToken() {
        return tokens.isEmpty() ? null : tokens.get(0);
    }
}
