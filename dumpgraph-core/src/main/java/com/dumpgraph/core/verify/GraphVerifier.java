package com.dumpgraph.core.verify;

import com.dumpgraph.core.model.Configuration;
import com.dumpgraph.core.model.Scope;
import com.dumpgraph.core.model.ScopeType;
import com.dumpgraph.core.model.Token;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Checks the structural invariants of a resolved configuration.
 *
 * <p>The analyzer guarantees these for well-formed dumps, so a violation points at a
 * corrupt or unsupported document rather than at the analyzed program. The verifier only
 * reports; it never changes the graph.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * List<Violation> violations = new GraphVerifier().verify(configuration);
 * }</pre>
 */
public class GraphVerifier {

    private static final Logger log = LoggerFactory.getLogger(GraphVerifier.class);

    /**
     * Checks every invariant of a configuration.
     *
     * @param configuration resolved configuration
     * @return violations in rule order, empty if the graph is consistent
     */
    public List<Violation> verify(Configuration configuration) {
        List<Violation> violations = new ArrayList<>();
        checkTokenSequence(configuration.tokens(), violations);
        checkAstParents(configuration.tokens(), violations);
        checkAstCycles(configuration.tokens(), violations);
        checkScopeTree(configuration.scopes(), violations);

        if (violations.isEmpty()) {
            log.debug("Configuration '{}' satisfies all graph invariants", configuration.name());
        } else {
            log.debug("Configuration '{}' has {} violations", configuration.name(), violations.size());
        }
        return violations;
    }

    // ==================== Tokens ====================

    void checkTokenSequence(List<Token> tokens, List<Violation> violations) {
        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            Token expectedPrevious = i > 0 ? tokens.get(i - 1) : null;
            Token expectedNext = i + 1 < tokens.size() ? tokens.get(i + 1) : null;
            if (token.previous() != expectedPrevious) {
                violations.add(new Violation(ViolationRule.TOKEN_SEQUENCE,
                    "Token " + token + " at position " + i + " has previous " + token.previous()));
            }
            if (token.next() != expectedNext) {
                violations.add(new Violation(ViolationRule.TOKEN_SEQUENCE,
                    "Token " + token + " at position " + i + " has next " + token.next()));
            }
        }
    }

    void checkAstParents(List<Token> tokens, List<Violation> violations) {
        Map<Token, Token> parents = new IdentityHashMap<>();
        for (Token token : tokens) {
            for (Token operand : operandsOf(token)) {
                if (operand == token) {
                    violations.add(new Violation(ViolationRule.AST_PARENT,
                        "Token " + token + " is its own operand"));
                    continue;
                }
                Token previous = parents.putIfAbsent(operand, token);
                if (previous != null && previous != token) {
                    violations.add(new Violation(ViolationRule.AST_PARENT,
                        "Token " + operand + " is an operand of both " + previous + " and " + token));
                }
            }
        }
    }

    void checkAstCycles(List<Token> tokens, List<Violation> violations) {
        Set<Token> acyclic = Collections.newSetFromMap(new IdentityHashMap<>());
        for (Token start : tokens) {
            Set<Token> path = Collections.newSetFromMap(new IdentityHashMap<>());
            Token current = start;
            while (current != null && !acyclic.contains(current)) {
                if (!path.add(current)) {
                    violations.add(new Violation(ViolationRule.AST_CYCLE,
                        "AST parent chain from " + start + " returns to " + current));
                    break;
                }
                current = current.astParent();
            }
            if (current == null || acyclic.contains(current)) {
                acyclic.addAll(path);
            }
        }
    }

    private static List<Token> operandsOf(Token token) {
        List<Token> operands = new ArrayList<>(2);
        if (token.astOperand1() != null) {
            operands.add(token.astOperand1());
        }
        if (token.astOperand2() != null && token.astOperand2() != token.astOperand1()) {
            operands.add(token.astOperand2());
        }
        return operands;
    }

    // ==================== Scopes ====================

    void checkScopeTree(List<Scope> scopes, List<Violation> violations) {
        if (scopes.isEmpty()) {
            return;
        }
        List<Scope> roots = new ArrayList<>();
        for (Scope scope : scopes) {
            if (scope.nestedIn() == null) {
                roots.add(scope);
            }
        }
        if (roots.size() != 1) {
            violations.add(new Violation(ViolationRule.SCOPE_ROOT,
                "Expected one root scope but found " + roots.size() + ": " + roots));
        } else if (roots.get(0).type() != ScopeType.GLOBAL) {
            violations.add(new Violation(ViolationRule.SCOPE_ROOT,
                "Root scope " + roots.get(0) + " is not the global scope"));
        }

        Set<Scope> rooted = Collections.newSetFromMap(new IdentityHashMap<>());
        for (Scope start : scopes) {
            Set<Scope> path = Collections.newSetFromMap(new IdentityHashMap<>());
            Scope current = start;
            while (current != null && !rooted.contains(current)) {
                if (!path.add(current)) {
                    violations.add(new Violation(ViolationRule.SCOPE_CYCLE,
                        "Scope nesting from " + start + " returns to " + current));
                    break;
                }
                current = current.nestedIn();
            }
            if (current == null || rooted.contains(current)) {
                rooted.addAll(path);
            }
        }
    }
}
