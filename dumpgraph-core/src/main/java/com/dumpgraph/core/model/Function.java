package com.dumpgraph.core.model;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * A function declaration.
 *
 * <p>Arguments are indexed by their 1-based position. The index may be sparse; a
 * position the dump does not list, or lists with a reserved zero identifier, yields
 * {@code null} from {@link #argument(int)}.
 */
public final class Function implements Resolvable {

    private final String id;
    private final String name;
    private final String type;
    private final boolean isVirtual;
    private final boolean isImplicitlyVirtual;
    private final boolean isStatic;
    private final String tokenDefId;
    private final SortedMap<Integer, String> argumentIds = new TreeMap<>();

    private Token tokenDef;
    private final SortedMap<Integer, Variable> arguments = new TreeMap<>();

    /**
     * Creates an unresolved function without arguments.
     *
     * @param id identifier of the function
     * @param name function name
     * @param type function kind as written in the dump, e.g. {@code Function} or {@code Constructor}
     * @param isVirtual whether the function is declared virtual
     * @param isImplicitlyVirtual whether a base class declares it virtual
     * @param isStatic whether the function is static
     * @param tokenDefId identifier of the name token in the definition
     */
    public Function(String id, String name, String type, boolean isVirtual, boolean isImplicitlyVirtual,
                    boolean isStatic, String tokenDefId) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.name = name;
        this.type = type;
        this.isVirtual = isVirtual;
        this.isImplicitlyVirtual = isImplicitlyVirtual;
        this.isStatic = isStatic;
        this.tokenDefId = tokenDefId;
    }

    /**
     * Records the variable identifier of an argument position. Called while the
     * {@code function} element is being read.
     *
     * @param position 1-based argument position
     * @param variableId identifier of the argument variable, may be null
     */
    public void declareArgument(int position, String variableId) {
        argumentIds.put(position, variableId);
    }

    @Override
    public void resolve(IdTable ids) {
        this.tokenDef = ids.lookup(tokenDefId, Token.class, this);
        arguments.clear();
        for (Map.Entry<Integer, String> entry : argumentIds.entrySet()) {
            Variable variable = ids.lookup(entry.getValue(), Variable.class, this);
            if (variable != null) {
                arguments.put(entry.getKey(), variable);
            }
        }
    }

    public String id() {
        return id;
    }

    public String name() {
        return name;
    }

    public String type() {
        return type;
    }

    public boolean isVirtual() {
        return isVirtual;
    }

    public boolean isImplicitlyVirtual() {
        return isImplicitlyVirtual;
    }

    public boolean isStatic() {
        return isStatic;
    }

    public Token tokenDef() {
        return tokenDef;
    }

    public String tokenDefId() {
        return tokenDefId;
    }

    /**
     * Returns the argument variable at a position.
     *
     * @param position 1-based position
     * @return the variable, or null if the position has none
     */
    public Variable argument(int position) {
        return arguments.get(position);
    }

    /**
     * Returns the resolved arguments by position.
     *
     * @return unmodifiable view, ordered by position
     */
    public SortedMap<Integer, Variable> arguments() {
        return Collections.unmodifiableSortedMap(arguments);
    }

    /**
     * Returns the raw argument identifiers by position.
     *
     * @return unmodifiable view, ordered by position
     */
    public SortedMap<Integer, String> argumentIds() {
        return Collections.unmodifiableSortedMap(argumentIds);
    }

    @Override
    public String toString() {
        return "Function{'" + name + "' " + id + "}";
    }
}
