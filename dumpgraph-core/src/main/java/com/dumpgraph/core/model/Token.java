package com.dumpgraph.core.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One lexical unit of a configuration's token list, or of the raw token stream.
 *
 * <p>A token is created in raw form, with every relation held as an identifier
 * string, and is resolved once its configuration has been read. After
 * {@link #resolve(IdTable)} the relations below are direct references:
 * <ul>
 *   <li>{@link #previous()} / {@link #next()} - strict sequence within the token list</li>
 *   <li>{@link #link()} - matching bracket, or the matching {@code >} of a template</li>
 *   <li>{@link #scope()}, {@link #typeScope()}, {@link #variable()}, {@link #function()}</li>
 *   <li>{@link #astParent()}, {@link #astOperand1()}, {@link #astOperand2()}</li>
 *   <li>{@link #values()} - possible values, empty when the analyzer computed none</li>
 * </ul>
 *
 * <p>Raw tokens have no identifier and no relations except the sequence links.
 */
public final class Token implements SourceLocation, Resolvable {

    private final String id;
    private final String str;
    private final TokenKind kind;
    private final NumberKind numberKind;
    private final OperatorKind operatorKind;
    private final boolean unsigned;
    private final boolean signed;
    private final boolean expandedMacro;
    private final Integer varId;
    private final Integer strlen;
    private final ValueType valueType;
    private final String file;
    private final int line;
    private final int column;

    private final String linkId;
    private final String scopeId;
    private final String typeScopeId;
    private final String variableId;
    private final String functionId;
    private final String valuesId;
    private final String astParentId;
    private final String astOperand1Id;
    private final String astOperand2Id;

    private Token previous;
    private Token next;
    private Token link;
    private Scope scope;
    private Scope typeScope;
    private Variable variable;
    private Function function;
    private List<Value> values = List.of();
    private Token astParent;
    private Token astOperand1;
    private Token astOperand2;

    private Token(Builder builder) {
        this.id = builder.id;
        this.str = Objects.requireNonNull(builder.str, "str must not be null");
        this.kind = Objects.requireNonNull(builder.kind, "kind must not be null");
        this.numberKind = builder.numberKind;
        this.operatorKind = builder.operatorKind;
        this.unsigned = builder.unsigned;
        this.signed = builder.signed;
        this.expandedMacro = builder.expandedMacro;
        this.varId = builder.varId;
        this.strlen = builder.strlen;
        this.valueType = builder.valueType;
        this.file = builder.file;
        this.line = builder.line;
        this.column = builder.column;
        this.linkId = builder.linkId;
        this.scopeId = builder.scopeId;
        this.typeScopeId = builder.typeScopeId;
        this.variableId = builder.variableId;
        this.functionId = builder.functionId;
        this.valuesId = builder.valuesId;
        this.astParentId = builder.astParentId;
        this.astOperand1Id = builder.astOperand1Id;
        this.astOperand2Id = builder.astOperand2Id;
    }

    /**
     * Starts building a token.
     *
     * @return new builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Links tokens into a doubly linked list in the given order.
     *
     * <p>The first token's {@code previous} and the last token's {@code next} are null.
     *
     * @param tokens tokens in document order
     */
    public static void linkSequence(List<Token> tokens) {
        Token prev = null;
        for (Token token : tokens) {
            token.previous = prev;
            token.next = null;
            if (prev != null) {
                prev.next = token;
            }
            prev = token;
        }
    }

    @Override
    public void resolve(IdTable ids) {
        this.link = ids.lookup(linkId, Token.class, this);
        this.scope = ids.lookup(scopeId, Scope.class, this);
        this.typeScope = ids.lookup(typeScopeId, Scope.class, this);
        this.variable = ids.lookup(variableId, Variable.class, this);
        this.function = ids.lookup(functionId, Function.class, this);
        ValueFlow flow = ids.lookup(valuesId, ValueFlow.class, this);
        this.values = flow != null ? flow.values() : List.of();
        this.astParent = ids.lookup(astParentId, Token.class, this);
        this.astOperand1 = ids.lookup(astOperand1Id, Token.class, this);
        this.astOperand2 = ids.lookup(astOperand2Id, Token.class, this);
        if (valueType != null) {
            valueType.resolve(ids);
        }
    }

    /**
     * Returns the first possible value with the given integer payload.
     *
     * @param intValue integer to look for
     * @return the value, or empty if the token has no such value
     */
    public Optional<Value> getValue(long intValue) {
        for (Value value : values) {
            if (value.intValue() != null && value.intValue() == intValue) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }

    // ==================== Classification ====================

    public String id() {
        return id;
    }

    public String str() {
        return str;
    }

    public TokenKind kind() {
        return kind;
    }

    public NumberKind numberKind() {
        return numberKind;
    }

    public OperatorKind operatorKind() {
        return operatorKind;
    }

    public boolean isName() {
        return kind == TokenKind.NAME;
    }

    public boolean isNumber() {
        return kind == TokenKind.NUMBER;
    }

    public boolean isInt() {
        return numberKind == NumberKind.INT;
    }

    public boolean isFloat() {
        return numberKind == NumberKind.FLOAT;
    }

    public boolean isString() {
        return kind == TokenKind.STRING;
    }

    public boolean isChar() {
        return kind == TokenKind.CHAR;
    }

    public boolean isOp() {
        return kind == TokenKind.OP;
    }

    public boolean isArithmeticalOp() {
        return operatorKind == OperatorKind.ARITHMETICAL;
    }

    public boolean isAssignmentOp() {
        return operatorKind == OperatorKind.ASSIGNMENT;
    }

    public boolean isComparisonOp() {
        return operatorKind == OperatorKind.COMPARISON;
    }

    public boolean isLogicalOp() {
        return operatorKind == OperatorKind.LOGICAL;
    }

    /**
     * Returns whether a name token is an unsigned type keyword or typedef.
     *
     * @return true if the analyzer flagged the token unsigned
     */
    public boolean isUnsigned() {
        return unsigned;
    }

    public boolean isSigned() {
        return signed;
    }

    public boolean isExpandedMacro() {
        return expandedMacro;
    }

    /**
     * Returns the analyzer's variable number; every variable has a unique non-zero number.
     *
     * @return variable number, or null
     */
    public Integer varId() {
        return varId;
    }

    /**
     * Returns the length of a string literal.
     *
     * @return string length, or null for other tokens
     */
    public Integer strlen() {
        return strlen;
    }

    public ValueType valueType() {
        return valueType;
    }

    // ==================== Location ====================

    @Override
    public String file() {
        return file;
    }

    @Override
    public int line() {
        return line;
    }

    @Override
    public int column() {
        return column;
    }

    // ==================== Relations ====================

    public Token previous() {
        return previous;
    }

    public Token next() {
        return next;
    }

    public Token link() {
        return link;
    }

    public Scope scope() {
        return scope;
    }

    public Scope typeScope() {
        return typeScope;
    }

    public Variable variable() {
        return variable;
    }

    public Function function() {
        return function;
    }

    public List<Value> values() {
        return values;
    }

    public Token astParent() {
        return astParent;
    }

    public Token astOperand1() {
        return astOperand1;
    }

    public Token astOperand2() {
        return astOperand2;
    }

    // ==================== Raw identifiers ====================

    public String linkId() {
        return linkId;
    }

    public String scopeId() {
        return scopeId;
    }

    public String typeScopeId() {
        return typeScopeId;
    }

    public String variableId() {
        return variableId;
    }

    public String functionId() {
        return functionId;
    }

    public String valuesId() {
        return valuesId;
    }

    public String astParentId() {
        return astParentId;
    }

    public String astOperand1Id() {
        return astOperand1Id;
    }

    public String astOperand2Id() {
        return astOperand2Id;
    }

    @Override
    public String toString() {
        return "Token{'" + str + "' " + file + ":" + line + ":" + column + (id != null ? " " + id : "") + "}";
    }

    /**
     * Collects the attributes of a token before it is created.
     */
    public static final class Builder {

        private String id;
        private String str;
        private TokenKind kind = TokenKind.OTHER;
        private NumberKind numberKind = NumberKind.NONE;
        private OperatorKind operatorKind = OperatorKind.NONE;
        private boolean unsigned;
        private boolean signed;
        private boolean expandedMacro;
        private Integer varId;
        private Integer strlen;
        private ValueType valueType;
        private String file;
        private int line;
        private int column;
        private String linkId;
        private String scopeId;
        private String typeScopeId;
        private String variableId;
        private String functionId;
        private String valuesId;
        private String astParentId;
        private String astOperand1Id;
        private String astOperand2Id;

        private Builder() {
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder str(String str) {
            this.str = str;
            return this;
        }

        public Builder kind(TokenKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder numberKind(NumberKind numberKind) {
            this.numberKind = numberKind;
            return this;
        }

        public Builder operatorKind(OperatorKind operatorKind) {
            this.operatorKind = operatorKind;
            return this;
        }

        public Builder unsigned(boolean unsigned) {
            this.unsigned = unsigned;
            return this;
        }

        public Builder signed(boolean signed) {
            this.signed = signed;
            return this;
        }

        public Builder expandedMacro(boolean expandedMacro) {
            this.expandedMacro = expandedMacro;
            return this;
        }

        public Builder varId(Integer varId) {
            this.varId = varId;
            return this;
        }

        public Builder strlen(Integer strlen) {
            this.strlen = strlen;
            return this;
        }

        public Builder valueType(ValueType valueType) {
            this.valueType = valueType;
            return this;
        }

        public Builder location(String file, int line, int column) {
            this.file = file;
            this.line = line;
            this.column = column;
            return this;
        }

        public Builder linkId(String linkId) {
            this.linkId = linkId;
            return this;
        }

        public Builder scopeId(String scopeId) {
            this.scopeId = scopeId;
            return this;
        }

        public Builder typeScopeId(String typeScopeId) {
            this.typeScopeId = typeScopeId;
            return this;
        }

        public Builder variableId(String variableId) {
            this.variableId = variableId;
            return this;
        }

        public Builder functionId(String functionId) {
            this.functionId = functionId;
            return this;
        }

        public Builder valuesId(String valuesId) {
            this.valuesId = valuesId;
            return this;
        }

        public Builder astParentId(String astParentId) {
            this.astParentId = astParentId;
            return this;
        }

        public Builder astOperand1Id(String astOperand1Id) {
            this.astOperand1Id = astOperand1Id;
            return this;
        }

        public Builder astOperand2Id(String astOperand2Id) {
            this.astOperand2Id = astOperand2Id;
            return this;
        }

        public Token build() {
            return new Token(this);
        }
    }
}
