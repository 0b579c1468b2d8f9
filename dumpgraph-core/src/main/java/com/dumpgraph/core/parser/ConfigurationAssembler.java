package com.dumpgraph.core.parser;

import com.dumpgraph.core.DumpFormatException;
import com.dumpgraph.core.model.Configuration;
import com.dumpgraph.core.model.Function;
import com.dumpgraph.core.model.ValueFlow;
import com.dumpgraph.core.parser.builder.ArgumentRecordBuilder;
import com.dumpgraph.core.parser.builder.DirectiveRecordBuilder;
import com.dumpgraph.core.parser.builder.FunctionArgument;
import com.dumpgraph.core.parser.builder.FunctionRecordBuilder;
import com.dumpgraph.core.parser.builder.ScopeRecordBuilder;
import com.dumpgraph.core.parser.builder.StandardsAccumulator;
import com.dumpgraph.core.parser.builder.TokenRecordBuilder;
import com.dumpgraph.core.parser.builder.ValueFlowRecordBuilder;
import com.dumpgraph.core.parser.builder.ValueRecordBuilder;
import com.dumpgraph.core.parser.builder.VariableRecordBuilder;
import com.dumpgraph.core.resolve.ConfigurationRecords;
import com.dumpgraph.core.resolve.IdentifierResolver;
import com.dumpgraph.core.stream.DumpEvent;
import com.dumpgraph.core.stream.ElementAttributes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Accumulates the records of one {@code dump} element at a time and resolves them when
 * the element closes.
 *
 * <p>Events are fed in document order through {@link #accept(DumpEvent)}. Events outside
 * a {@code dump} element are ignored, as are tags the assembler does not know. After a
 * configuration has been returned, or its resolution has failed, the assembler starts
 * over with empty records.
 */
public class ConfigurationAssembler {

    private static final Logger log = LoggerFactory.getLogger(ConfigurationAssembler.class);

    static final String DUMP_TAG = "dump";
    static final String VARLIST_TAG = "varlist";

    private final TokenRecordBuilder tokenBuilder = new TokenRecordBuilder();
    private final ScopeRecordBuilder scopeBuilder = new ScopeRecordBuilder();
    private final FunctionRecordBuilder functionBuilder = new FunctionRecordBuilder();
    private final ArgumentRecordBuilder argumentBuilder = new ArgumentRecordBuilder();
    private final VariableRecordBuilder variableBuilder = new VariableRecordBuilder();
    private final ValueFlowRecordBuilder valueFlowBuilder = new ValueFlowRecordBuilder();
    private final ValueRecordBuilder valueBuilder = new ValueRecordBuilder();
    private final DirectiveRecordBuilder directiveBuilder = new DirectiveRecordBuilder();
    private final IdentifierResolver resolver;

    private ConfigurationRecords records;
    private VariableContext variableContext = VariableContext.DECLARATIONS;
    private StandardsAccumulator standards;
    private Function currentFunction;
    private ValueFlow currentValues;

    public ConfigurationAssembler() {
        this(new IdentifierResolver());
    }

    public ConfigurationAssembler(IdentifierResolver resolver) {
        this.resolver = resolver;
    }

    /**
     * Feeds one event.
     *
     * @param event next event of the document
     * @return the resolved configuration if the event closed a {@code dump} element, else null
     * @throws DumpFormatException if the configuration is malformed or does not resolve
     */
    public Configuration accept(DumpEvent event) {
        if (event.isEnter()) {
            enter(event.attributes());
            return null;
        }
        return exit(event.tag());
    }

    /**
     * Returns whether a configuration is being accumulated.
     *
     * @return true between {@code <dump>} and {@code </dump>}
     */
    public boolean inConfiguration() {
        return records != null;
    }

    // ==================== Element start ====================

    private void enter(ElementAttributes attributes) {
        String tag = attributes.tag();
        if (records == null) {
            if (DUMP_TAG.equals(tag)) {
                records = new ConfigurationRecords(attributes.get("cfg"));
                log.debug("Reading configuration '{}' at line {}", records.name(), attributes.line());
            }
            return;
        }
        if (standards != null) {
            standards.accept(attributes);
            return;
        }

        switch (tag) {
            case StandardsAccumulator.TAG -> standards = new StandardsAccumulator();
            case DirectiveRecordBuilder.TAG -> records.addDirective(directiveBuilder.build(attributes));
            case TokenRecordBuilder.TAG -> records.addToken(tokenBuilder.build(attributes));
            case ScopeRecordBuilder.TAG -> records.addScope(scopeBuilder.build(attributes));
            case VARLIST_TAG -> variableContext = VariableContext.SCOPE_VARLIST;
            case VariableRecordBuilder.TAG -> routeVariable(attributes);
            case FunctionRecordBuilder.TAG -> {
                currentFunction = functionBuilder.build(attributes);
                records.addFunction(currentFunction);
            }
            case ArgumentRecordBuilder.TAG -> {
                if (currentFunction == null) {
                    throw new DumpFormatException("Element 'arg' at line " + attributes.line() + " is outside a function");
                }
                FunctionArgument argument = argumentBuilder.build(attributes);
                currentFunction.declareArgument(argument.position(), argument.variableId());
            }
            case ValueFlowRecordBuilder.TAG -> {
                currentValues = valueFlowBuilder.build(attributes);
                records.addValueFlow(currentValues);
            }
            case ValueRecordBuilder.TAG -> {
                if (currentValues == null) {
                    throw new DumpFormatException("Element 'value' at line " + attributes.line() + " is outside a value list");
                }
                currentValues.add(valueBuilder.build(attributes));
            }
            default -> {
                // containers such as tokenlist, scopes, functionList, variables, valueflow
            }
        }
    }

    private void routeVariable(ElementAttributes attributes) {
        VariableRoute route = VariableRoute.select(variableContext, attributes.reference("nameToken") != null);
        switch (route) {
            case CONFIGURATION_VARIABLE -> records.addVariable(variableBuilder.build(attributes));
            case ARGUMENT -> records.addArgumentVariable(variableBuilder.build(attributes));
            case DECLARED_LISTING -> {
                // listed again by its declaration
            }
        }
    }

    // ==================== Element end ====================

    private Configuration exit(String tag) {
        if (records == null) {
            return null;
        }
        switch (tag) {
            case StandardsAccumulator.TAG -> {
                if (standards != null) {
                    records.setStandards(standards.build());
                    standards = null;
                }
            }
            case VARLIST_TAG -> variableContext = VariableContext.DECLARATIONS;
            case FunctionRecordBuilder.TAG -> currentFunction = null;
            case ValueFlowRecordBuilder.TAG -> currentValues = null;
            case DUMP_TAG -> {
                return finish();
            }
            default -> {
                // nothing to close
            }
        }
        return null;
    }

    private Configuration finish() {
        ConfigurationRecords finished = records;
        try {
            return resolver.resolve(finished);
        } finally {
            reset();
        }
    }

    private void reset() {
        records = null;
        variableContext = VariableContext.DECLARATIONS;
        standards = null;
        currentFunction = null;
        currentValues = null;
    }
}
