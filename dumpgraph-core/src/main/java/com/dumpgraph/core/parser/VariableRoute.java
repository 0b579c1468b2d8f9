package com.dumpgraph.core.parser;

/**
 * Destination of a {@code var} element.
 *
 * <p>The same element is used for declared variables, for argument variables and for the
 * per-scope listing of declared variables; only its context and whether it names a token
 * tell them apart.
 */
public enum VariableRoute {
    /** A variable with a name token; goes to the configuration's variable list */
    CONFIGURATION_VARIABLE,
    /** An entry of a scope's listing; already declared elsewhere, so not kept */
    DECLARED_LISTING,
    /** A variable without a name token outside the listing; kept as an argument variable */
    ARGUMENT;

    /**
     * Selects the destination of a variable.
     *
     * @param context where the element was found
     * @param hasNameToken whether the element names a token
     * @return destination
     */
    public static VariableRoute select(VariableContext context, boolean hasNameToken) {
        return switch (context) {
            case SCOPE_VARLIST -> DECLARED_LISTING;
            case DECLARATIONS -> hasNameToken ? CONFIGURATION_VARIABLE : ARGUMENT;
        };
    }
}
