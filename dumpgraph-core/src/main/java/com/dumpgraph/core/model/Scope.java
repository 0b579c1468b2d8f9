package com.dumpgraph.core.model;

import java.util.Objects;

/**
 * A lexical region: the global scope, a namespace or class body, a function body, or a
 * block introduced by a conditional, loop or exception handler.
 *
 * <p>Scopes nest through {@link #nestedIn()} into a tree rooted at the single global scope.
 */
public final class Scope implements Resolvable {

    private final String id;
    private final String className;
    private final String typeName;
    private final ScopeType type;
    private final String bodyStartId;
    private final String bodyEndId;
    private final String functionId;
    private final String nestedInId;

    private Token bodyStart;
    private Token bodyEnd;
    private Function function;
    private Scope nestedIn;

    /**
     * Creates an unresolved scope.
     *
     * @param id identifier of the scope
     * @param className display name: function name for function scopes, class name for class scopes
     * @param typeName kind as written in the dump, e.g. {@code Function}
     * @param bodyStartId identifier of the opening brace token, may be null
     * @param bodyEndId identifier of the closing brace token, may be null
     * @param functionId identifier of the function owning a function body, may be null
     * @param nestedInId identifier of the enclosing scope, null for the global scope
     */
    public Scope(String id, String className, String typeName, String bodyStartId, String bodyEndId,
                 String functionId, String nestedInId) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.className = className;
        this.typeName = typeName;
        this.type = ScopeType.fromDumpName(typeName);
        this.bodyStartId = bodyStartId;
        this.bodyEndId = bodyEndId;
        this.functionId = functionId;
        this.nestedInId = nestedInId;
    }

    @Override
    public void resolve(IdTable ids) {
        this.bodyStart = ids.lookup(bodyStartId, Token.class, this);
        this.bodyEnd = ids.lookup(bodyEndId, Token.class, this);
        this.function = ids.lookup(functionId, Function.class, this);
        this.nestedIn = ids.lookup(nestedInId, Scope.class, this);
    }

    public String id() {
        return id;
    }

    public String className() {
        return className;
    }

    /**
     * Returns the kind exactly as the dump spelled it, also for kinds mapped to {@link ScopeType#OTHER}.
     *
     * @return dump spelling of the kind
     */
    public String typeName() {
        return typeName;
    }

    public ScopeType type() {
        return type;
    }

    public boolean isExecutable() {
        return type.isExecutable();
    }

    public Token bodyStart() {
        return bodyStart;
    }

    public Token bodyEnd() {
        return bodyEnd;
    }

    public Function function() {
        return function;
    }

    public Scope nestedIn() {
        return nestedIn;
    }

    public String bodyStartId() {
        return bodyStartId;
    }

    public String bodyEndId() {
        return bodyEndId;
    }

    public String functionId() {
        return functionId;
    }

    public String nestedInId() {
        return nestedInId;
    }

    @Override
    public String toString() {
        return "Scope{" + typeName + " '" + className + "' " + id + "}";
    }
}
