package com.dumpgraph.core.model;

import java.util.Objects;

/**
 * A variable declaration, including function arguments.
 *
 * <p>Argument variables of declarations without a parameter name have no name token.
 */
public final class Variable implements Resolvable {

    private final String id;
    private final String nameTokenId;
    private final String typeStartTokenId;
    private final String typeEndTokenId;
    private final String scopeId;
    private final VariableAccess access;
    private final boolean isArgument;
    private final boolean isArray;
    private final boolean isClass;
    private final boolean isConst;
    private final boolean isExtern;
    private final boolean isLocal;
    private final boolean isPointer;
    private final boolean isReference;
    private final boolean isStatic;
    private final int constness;

    private Token nameToken;
    private Token typeStartToken;
    private Token typeEndToken;
    private Scope scope;

    private Variable(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id must not be null");
        this.nameTokenId = builder.nameTokenId;
        this.typeStartTokenId = builder.typeStartTokenId;
        this.typeEndTokenId = builder.typeEndTokenId;
        this.scopeId = builder.scopeId;
        this.access = Objects.requireNonNull(builder.access, "access must not be null");
        this.isArgument = builder.isArgument;
        this.isArray = builder.isArray;
        this.isClass = builder.isClass;
        this.isConst = builder.isConst;
        this.isExtern = builder.isExtern;
        this.isLocal = builder.isLocal;
        this.isPointer = builder.isPointer;
        this.isReference = builder.isReference;
        this.isStatic = builder.isStatic;
        this.constness = builder.constness;
    }

    /**
     * Starts building a variable.
     *
     * @param id identifier of the variable
     * @return new builder
     */
    public static Builder builder(String id) {
        return new Builder(id);
    }

    @Override
    public void resolve(IdTable ids) {
        this.nameToken = ids.lookup(nameTokenId, Token.class, this);
        this.typeStartToken = ids.lookup(typeStartTokenId, Token.class, this);
        this.typeEndToken = ids.lookup(typeEndTokenId, Token.class, this);
        this.scope = ids.lookup(scopeId, Scope.class, this);
    }

    public String id() {
        return id;
    }

    public VariableAccess access() {
        return access;
    }

    public boolean isArgument() {
        return isArgument;
    }

    public boolean isArray() {
        return isArray;
    }

    public boolean isClass() {
        return isClass;
    }

    public boolean isConst() {
        return isConst;
    }

    public boolean isExtern() {
        return isExtern;
    }

    /**
     * Returns whether the variable has global access.
     *
     * @return true when {@link #access()} is {@link VariableAccess#GLOBAL}
     */
    public boolean isGlobal() {
        return access == VariableAccess.GLOBAL;
    }

    public boolean isLocal() {
        return isLocal;
    }

    public boolean isPointer() {
        return isPointer;
    }

    public boolean isReference() {
        return isReference;
    }

    public boolean isStatic() {
        return isStatic;
    }

    /**
     * Returns the constness bit mask, encoded as in {@link ValueType#constness()}.
     *
     * @return constness
     */
    public int constness() {
        return constness;
    }

    public Token nameToken() {
        return nameToken;
    }

    public Token typeStartToken() {
        return typeStartToken;
    }

    public Token typeEndToken() {
        return typeEndToken;
    }

    public Scope scope() {
        return scope;
    }

    public String nameTokenId() {
        return nameTokenId;
    }

    public String typeStartTokenId() {
        return typeStartTokenId;
    }

    public String typeEndTokenId() {
        return typeEndTokenId;
    }

    public String scopeId() {
        return scopeId;
    }

    @Override
    public String toString() {
        return "Variable{" + id + (nameToken != null ? " '" + nameToken.str() + "'" : "") + " " + access + "}";
    }

    /**
     * Collects the attributes of a variable before it is created.
     */
    public static final class Builder {

        private final String id;
        private String nameTokenId;
        private String typeStartTokenId;
        private String typeEndTokenId;
        private String scopeId;
        private VariableAccess access = VariableAccess.UNKNOWN;
        private boolean isArgument;
        private boolean isArray;
        private boolean isClass;
        private boolean isConst;
        private boolean isExtern;
        private boolean isLocal;
        private boolean isPointer;
        private boolean isReference;
        private boolean isStatic;
        private int constness;

        private Builder(String id) {
            this.id = id;
        }

        public Builder nameTokenId(String nameTokenId) {
            this.nameTokenId = nameTokenId;
            return this;
        }

        public Builder typeTokenIds(String typeStartTokenId, String typeEndTokenId) {
            this.typeStartTokenId = typeStartTokenId;
            this.typeEndTokenId = typeEndTokenId;
            return this;
        }

        public Builder scopeId(String scopeId) {
            this.scopeId = scopeId;
            return this;
        }

        public Builder access(VariableAccess access) {
            this.access = access;
            return this;
        }

        public Builder argument(boolean isArgument) {
            this.isArgument = isArgument;
            return this;
        }

        public Builder array(boolean isArray) {
            this.isArray = isArray;
            return this;
        }

        public Builder classType(boolean isClass) {
            this.isClass = isClass;
            return this;
        }

        public Builder constant(boolean isConst) {
            this.isConst = isConst;
            return this;
        }

        public Builder external(boolean isExtern) {
            this.isExtern = isExtern;
            return this;
        }

        public Builder local(boolean isLocal) {
            this.isLocal = isLocal;
            return this;
        }

        public Builder pointer(boolean isPointer) {
            this.isPointer = isPointer;
            return this;
        }

        public Builder reference(boolean isReference) {
            this.isReference = isReference;
            return this;
        }

        public Builder staticStorage(boolean isStatic) {
            this.isStatic = isStatic;
            return this;
        }

        public Builder constness(int constness) {
            this.constness = constness;
            return this;
        }

        public Variable build() {
            return new Variable(this);
        }
    }
}
