package com.dumpgraph.core.resolve;

import com.dumpgraph.core.model.Configuration;
import com.dumpgraph.core.model.Function;
import com.dumpgraph.core.model.IdTable;
import com.dumpgraph.core.model.Resolvable;
import com.dumpgraph.core.model.Scope;
import com.dumpgraph.core.model.Token;
import com.dumpgraph.core.model.ValueFlow;
import com.dumpgraph.core.model.Variable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Second pass over one configuration: turns identifier strings into references.
 *
 * <p>Resolution runs in two steps. First every record is registered in an {@link IdTable};
 * only then are relations rewritten, so the order in which records appeared in the
 * document does not matter. The table is local to one call and dropped afterwards.
 *
 * <p>Errors:
 * <ul>
 *   <li>{@link com.dumpgraph.core.UnresolvedIdentifierException} - an identifier names no record</li>
 *   <li>{@link com.dumpgraph.core.DumpFormatException} - an identifier names a record of the
 *       wrong kind, or is issued twice</li>
 * </ul>
 */
public class IdentifierResolver {

    private static final Logger log = LoggerFactory.getLogger(IdentifierResolver.class);

    /**
     * Resolves the records of one configuration.
     *
     * @param records accumulated raw records
     * @return the resolved configuration
     */
    public Configuration resolve(ConfigurationRecords records) {
        IdTable ids = buildTable(records);

        Token.linkSequence(records.tokens());
        resolveAll(records.tokens(), ids);
        resolveAll(records.scopes(), ids);
        resolveAll(records.functions(), ids);
        resolveAll(records.variables(), ids);
        resolveAll(records.argumentVariables(), ids);
        for (ValueFlow flow : records.valueFlows()) {
            resolveAll(flow.values(), ids);
        }

        log.debug("Resolved configuration '{}': {} tokens, {} scopes, {} functions, {} variables, {} argument variables, {} value lists",
            records.name(), records.tokens().size(), records.scopes().size(), records.functions().size(),
            records.variables().size(), records.argumentVariables().size(), records.valueFlows().size());

        return new Configuration(
            records.name(),
            records.standards(),
            records.directives(),
            records.tokens(),
            records.scopes(),
            records.functions(),
            records.variables(),
            records.argumentVariables(),
            records.valueFlows());
    }

    /**
     * Registers every identified record of a configuration.
     *
     * @param records accumulated raw records
     * @return the filled table
     * @throws com.dumpgraph.core.DumpFormatException if an identifier is issued twice
     */
    public IdTable buildTable(ConfigurationRecords records) {
        IdTable ids = new IdTable();
        for (Token token : records.tokens()) {
            ids.register(token.id(), token);
        }
        for (Scope scope : records.scopes()) {
            ids.register(scope.id(), scope);
        }
        for (Function function : records.functions()) {
            ids.register(function.id(), function);
        }
        for (Variable variable : records.variables()) {
            ids.register(variable.id(), variable);
        }
        for (Variable variable : records.argumentVariables()) {
            ids.register(variable.id(), variable);
        }
        for (ValueFlow flow : records.valueFlows()) {
            ids.register(flow.id(), flow);
        }
        log.debug("Registered {} identifiers for configuration '{}'", ids.size(), records.name());
        return ids;
    }

    private static void resolveAll(List<? extends Resolvable> records, IdTable ids) {
        for (Resolvable record : records) {
            record.resolve(ids);
        }
    }
}
