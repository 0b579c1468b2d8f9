package com.dumpgraph.core.model;

import java.util.Set;

/**
 * Promoted type of an AST node, as computed by the analyzer.
 *
 * <p>Carried on a {@link Token}; the type scope is resolved together with its token.
 */
public final class ValueType implements Resolvable {

    private static final Set<String> INTEGRAL_TYPES = Set.of("bool", "char", "short", "int", "long", "long long");
    private static final Set<String> FLOAT_TYPES = Set.of("float", "double", "long double");

    private final String type;
    private final String sign;
    private final int bits;
    private final int pointer;
    private final int constness;
    private final String originalTypeName;
    private final String typeScopeId;

    private Scope typeScope;

    /**
     * Creates an unresolved value type.
     *
     * @param type base type name, e.g. {@code int} or {@code record}
     * @param sign {@code signed}, {@code unsigned}, or null
     * @param bits bit width for bit fields, 0 otherwise
     * @param pointer pointer depth
     * @param constness constness bit mask, one bit per indirection level
     * @param originalTypeName type name before promotion, may be null
     * @param typeScopeId identifier of the type's scope, may be null
     */
    public ValueType(String type, String sign, int bits, int pointer, int constness,
                     String originalTypeName, String typeScopeId) {
        this.type = type;
        this.sign = sign;
        this.bits = bits;
        this.pointer = pointer;
        this.constness = constness;
        this.originalTypeName = originalTypeName;
        this.typeScopeId = typeScopeId;
    }

    @Override
    public void resolve(IdTable ids) {
        this.typeScope = ids.lookup(typeScopeId, Scope.class, this);
    }

    public String type() {
        return type;
    }

    public String sign() {
        return sign;
    }

    public int bits() {
        return bits;
    }

    public int pointer() {
        return pointer;
    }

    public int constness() {
        return constness;
    }

    public String originalTypeName() {
        return originalTypeName;
    }

    public String typeScopeId() {
        return typeScopeId;
    }

    /**
     * Returns the scope of the type (class, struct, enum), or null for builtin types.
     *
     * @return type scope
     */
    public Scope typeScope() {
        return typeScope;
    }

    public boolean isIntegral() {
        return INTEGRAL_TYPES.contains(type);
    }

    public boolean isFloat() {
        return FLOAT_TYPES.contains(type);
    }

    /**
     * Returns whether the type is an enumeration, judged by the kind of its type scope.
     *
     * @return true if the resolved type scope is an enum scope
     */
    public boolean isEnum() {
        return typeScope != null && typeScope.type() == ScopeType.ENUM;
    }

    public boolean isSigned() {
        return "signed".equals(sign);
    }

    public boolean isUnsigned() {
        return "unsigned".equals(sign);
    }

    @Override
    public String toString() {
        return "ValueType{" + (sign != null ? sign + " " : "") + type + "*".repeat(Math.max(0, pointer)) + "}";
    }
}
