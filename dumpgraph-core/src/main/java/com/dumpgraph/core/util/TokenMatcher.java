package com.dumpgraph.core.util;

import com.dumpgraph.core.model.Token;
import com.dumpgraph.core.model.Variable;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Token-level helpers for rule checkers working on a resolved configuration.
 */
public final class TokenMatcher {

    private static final Set<String> ARITHMETIC_OPERATORS = Set.of("+", "-", "*", "/", "%");

    private TokenMatcher() {
        // Utility class
    }

    /**
     * Returns the arguments of a function call.
     *
     * <p>The call is recognized as a name token followed by {@code (}. The comma tree under
     * the parenthesis is flattened left to right, so {@code f(a, b, c)} yields
     * {@code [a, b, c]}.
     *
     * @param functionToken name token of the call
     * @return argument root tokens in order, empty for a call without arguments, or null if
     *         the token does not start a call
     */
    public static List<Token> arguments(Token functionToken) {
        if (functionToken == null || !functionToken.isName()) {
            return null;
        }
        Token parenthesis = functionToken.next();
        if (parenthesis == null || !"(".equals(parenthesis.str())) {
            return null;
        }
        List<Token> arguments = new ArrayList<>();
        collectArguments(parenthesis.astOperand2(), arguments);
        return arguments;
    }

    private static void collectArguments(Token token, List<Token> arguments) {
        if (token == null) {
            return;
        }
        if (",".equals(token.str())) {
            collectArguments(token.astOperand1(), arguments);
            collectArguments(token.astOperand2(), arguments);
        } else {
            arguments.add(token);
        }
    }

    /**
     * Matches a space-separated sequence of literal token texts, starting at a token.
     *
     * <p>{@code simpleMatch(tok, "if (")} is true if {@code tok} is {@code if} and the next
     * token is {@code (}.
     *
     * @param token first token to compare, may be null
     * @param pattern token texts separated by single spaces
     * @return true if every pattern element matches the corresponding token
     */
    public static boolean simpleMatch(Token token, String pattern) {
        Token current = token;
        for (String expected : pattern.split(" ")) {
            if (current == null || !expected.equals(current.str())) {
                return false;
            }
            current = current.next();
        }
        return true;
    }

    /**
     * Returns whether an expression has a floating-point type.
     *
     * <p>Looks through member access to the member, through arithmetic to either operand,
     * at floating-point literals, and at the declared type of variables.
     *
     * @param token root of the expression, may be null
     * @return true if the expression is {@code float} or {@code double}
     */
    public static boolean isFloatExpression(Token token) {
        if (token == null) {
            return false;
        }
        String str = token.str();
        if (".".equals(str)) {
            return isFloatExpression(token.astOperand2());
        }
        if (ARITHMETIC_OPERATORS.contains(str)) {
            return isFloatExpression(token.astOperand1()) || isFloatExpression(token.astOperand2());
        }
        Variable variable = token.variable();
        if (variable == null) {
            return isFloatLiteral(str);
        }
        return declaresFloatingType(variable);
    }

    static boolean isFloatLiteral(String str) {
        if (str.isEmpty() || !Character.isDigit(str.charAt(0))) {
            return false;
        }
        boolean hex = str.length() > 1 && (str.charAt(1) == 'x' || str.charAt(1) == 'X');
        for (int i = 0; i < str.length(); i++) {
            char c = str.charAt(i);
            if (c == '.') {
                return true;
            }
            if (hex ? (c == 'p' || c == 'P') : (c == 'f' || c == 'F' || c == 'e' || c == 'E')) {
                return true;
            }
        }
        return false;
    }

    private static boolean declaresFloatingType(Variable variable) {
        Token end = variable.typeEndToken();
        for (Token current = variable.typeStartToken(); current != null; current = current.next()) {
            if ("float".equals(current.str()) || "double".equals(current.str())) {
                return true;
            }
            if (current == end) {
                break;
            }
        }
        return false;
    }
}
