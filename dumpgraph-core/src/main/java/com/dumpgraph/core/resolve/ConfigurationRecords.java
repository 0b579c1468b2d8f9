package com.dumpgraph.core.resolve;

import com.dumpgraph.core.model.Directive;
import com.dumpgraph.core.model.Function;
import com.dumpgraph.core.model.Scope;
import com.dumpgraph.core.model.Standards;
import com.dumpgraph.core.model.Token;
import com.dumpgraph.core.model.ValueFlow;
import com.dumpgraph.core.model.Variable;

import java.util.ArrayList;
import java.util.List;

/**
 * Raw records of one configuration, accumulated in document order while its {@code dump}
 * element is read. Relations are still identifier strings.
 *
 * <p>Argument variables are kept apart from declared variables: they are the variables
 * without a name token, and a function's {@code arg} elements may reference them before
 * they have been read.
 */
public final class ConfigurationRecords {

    private final String name;
    private Standards standards;
    private final List<Directive> directives = new ArrayList<>();
    private final List<Token> tokens = new ArrayList<>();
    private final List<Scope> scopes = new ArrayList<>();
    private final List<Function> functions = new ArrayList<>();
    private final List<Variable> variables = new ArrayList<>();
    private final List<Variable> argumentVariables = new ArrayList<>();
    private final List<ValueFlow> valueFlows = new ArrayList<>();

    /**
     * Creates empty records for a configuration.
     *
     * @param name configuration name; null is read as the default configuration
     */
    public ConfigurationRecords(String name) {
        this.name = name == null ? "" : name;
    }

    public void setStandards(Standards standards) {
        this.standards = standards;
    }

    public void addDirective(Directive directive) {
        directives.add(directive);
    }

    public void addToken(Token token) {
        tokens.add(token);
    }

    public void addScope(Scope scope) {
        scopes.add(scope);
    }

    public void addFunction(Function function) {
        functions.add(function);
    }

    public void addVariable(Variable variable) {
        variables.add(variable);
    }

    public void addArgumentVariable(Variable variable) {
        argumentVariables.add(variable);
    }

    public void addValueFlow(ValueFlow valueFlow) {
        valueFlows.add(valueFlow);
    }

    public String name() {
        return name;
    }

    public Standards standards() {
        return standards;
    }

    public List<Directive> directives() {
        return directives;
    }

    public List<Token> tokens() {
        return tokens;
    }

    public List<Scope> scopes() {
        return scopes;
    }

    public List<Function> functions() {
        return functions;
    }

    public List<Variable> variables() {
        return variables;
    }

    public List<Variable> argumentVariables() {
        return argumentVariables;
    }

    public List<ValueFlow> valueFlows() {
        return valueFlows;
    }

    /**
     * Returns the number of records that carry an identifier.
     *
     * @return count of tokens, scopes, functions, variables and value lists
     */
    public int identifiedCount() {
        return tokens.size() + scopes.size() + functions.size() + variables.size()
            + argumentVariables.size() + valueFlows.size();
    }
}
