package com.dumpgraph.core.parser;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link VariableRoute}.
 */
class VariableRouteTest {

    @Test
    void select_declarationWithNameToken_isConfigurationVariable() {
        assertThat(VariableRoute.select(VariableContext.DECLARATIONS, true))
            .isEqualTo(VariableRoute.CONFIGURATION_VARIABLE);
    }

    @Test
    void select_declarationWithoutNameToken_isArgument() {
        assertThat(VariableRoute.select(VariableContext.DECLARATIONS, false))
            .isEqualTo(VariableRoute.ARGUMENT);
    }

    @Test
    void select_scopeListing_isAlwaysDeclaredListing() {
        assertThat(VariableRoute.select(VariableContext.SCOPE_VARLIST, false))
            .isEqualTo(VariableRoute.DECLARED_LISTING);
        assertThat(VariableRoute.select(VariableContext.SCOPE_VARLIST, true))
            .isEqualTo(VariableRoute.DECLARED_LISTING);
    }
}
