package com.dumpgraph.core.verify;

import com.dumpgraph.core.model.Configuration;
import com.dumpgraph.core.model.Scope;
import com.dumpgraph.core.model.Token;
import com.dumpgraph.core.model.TokenKind;
import com.dumpgraph.core.resolve.ConfigurationRecords;
import com.dumpgraph.core.resolve.IdentifierResolver;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link GraphVerifier}.
 */
class GraphVerifierTest {

    private final GraphVerifier verifier = new GraphVerifier();

    private static Token.Builder token(String id, String str) {
        return Token.builder().id(id).str(str).kind(TokenKind.NAME).location("a.c", 1, 1);
    }

    private static Scope global(String id) {
        return new Scope(id, "", "Global", null, null, null, null);
    }

    private static Configuration resolve(ConfigurationRecords records) {
        return new IdentifierResolver().resolve(records);
    }

    private static List<ViolationRule> rules(List<Violation> violations) {
        return violations.stream().map(Violation::rule).toList();
    }

    @Test
    void verify_consistentGraph_hasNoViolations() {
        ConfigurationRecords records = new ConfigurationRecords("");
        records.addToken(token("t1", "a").astParentId("t2").build());
        records.addToken(token("t2", "=").astOperand1Id("t1").astOperand2Id("t3").build());
        records.addToken(token("t3", "b").astParentId("t2").build());
        records.addScope(global("s1"));
        records.addScope(new Scope("s2", "f", "Function", null, null, null, "s1"));

        assertThat(verifier.verify(resolve(records))).isEmpty();
    }

    @Test
    void verify_emptyConfiguration_hasNoViolations() {
        assertThat(verifier.verify(resolve(new ConfigurationRecords("")))).isEmpty();
    }

    @Test
    void verify_sequenceOutOfListOrder_reportsTokenSequence() {
        Token a = token("t1", "a").build();
        Token b = token("t2", "b").build();
        Token c = token("t3", "c").build();
        Token.linkSequence(List.of(a, b, c));
        Configuration configuration = new Configuration("", null, null, List.of(a, c, b), null, null, null, null, null);

        assertThat(rules(verifier.verify(configuration))).contains(ViolationRule.TOKEN_SEQUENCE);
    }

    @Test
    void verify_operandSharedByTwoParents_reportsAstParent() {
        ConfigurationRecords records = new ConfigurationRecords("");
        records.addToken(token("t1", "+").astOperand1Id("t3").build());
        records.addToken(token("t2", "-").astOperand1Id("t3").build());
        records.addToken(token("t3", "x").astParentId("t1").build());

        List<Violation> violations = verifier.verify(resolve(records));

        assertThat(rules(violations)).containsExactly(ViolationRule.AST_PARENT);
        assertThat(violations.get(0).message()).contains("'x'");
    }

    @Test
    void verify_parentCycle_reportsAstCycle() {
        ConfigurationRecords records = new ConfigurationRecords("");
        records.addToken(token("t1", "a").astParentId("t2").build());
        records.addToken(token("t2", "b").astParentId("t1").build());

        assertThat(rules(verifier.verify(resolve(records)))).contains(ViolationRule.AST_CYCLE);
    }

    @Test
    void verify_twoRootScopes_reportsScopeRoot() {
        ConfigurationRecords records = new ConfigurationRecords("");
        records.addScope(global("s1"));
        records.addScope(global("s2"));

        assertThat(rules(verifier.verify(resolve(records)))).containsExactly(ViolationRule.SCOPE_ROOT);
    }

    @Test
    void verify_rootThatIsNotGlobal_reportsScopeRoot() {
        ConfigurationRecords records = new ConfigurationRecords("");
        records.addScope(new Scope("s1", "N", "Namespace", null, null, null, null));

        List<Violation> violations = verifier.verify(resolve(records));

        assertThat(rules(violations)).containsExactly(ViolationRule.SCOPE_ROOT);
        assertThat(violations.get(0).message()).contains("not the global scope");
    }

    @Test
    void verify_nestingCycle_reportsScopeCycle() {
        ConfigurationRecords records = new ConfigurationRecords("");
        records.addScope(global("s1"));
        records.addScope(new Scope("s2", "", "If", null, null, null, "s3"));
        records.addScope(new Scope("s3", "", "Else", null, null, null, "s2"));

        assertThat(rules(verifier.verify(resolve(records)))).contains(ViolationRule.SCOPE_CYCLE);
    }
}
