package com.dumpgraph.core.model;

/**
 * Kind of a lexical scope.
 *
 * <p>Executable scopes are those whose body contains statements: function bodies,
 * conditionals, loops, exception handlers, unconditional blocks and lambdas.
 */
public enum ScopeType {
    GLOBAL("Global", false),
    CLASS("Class", false),
    STRUCT("Struct", false),
    UNION("Union", false),
    NAMESPACE("Namespace", false),
    ENUM("Enum", false),
    FUNCTION("Function", true),
    IF("If", true),
    ELSE("Else", true),
    FOR("For", true),
    WHILE("While", true),
    DO("Do", true),
    SWITCH("Switch", true),
    TRY("Try", true),
    CATCH("Catch", true),
    UNCONDITIONAL("Unconditional", true),
    LAMBDA("Lambda", true),
    /** Any kind this reader does not know */
    OTHER("", false);

    private final String dumpName;
    private final boolean executable;

    ScopeType(String dumpName, boolean executable) {
        this.dumpName = dumpName;
        this.executable = executable;
    }

    /**
     * Returns whether scopes of this kind contain executable statements.
     *
     * @return true for function bodies, conditionals, loops and similar
     */
    public boolean isExecutable() {
        return executable;
    }

    /**
     * Maps a {@code type} attribute value to a scope kind.
     *
     * @param name attribute value, may be null
     * @return matching kind, or {@link #OTHER}
     */
    public static ScopeType fromDumpName(String name) {
        if (name != null) {
            for (ScopeType type : values()) {
                if (type != OTHER && type.dumpName.equals(name)) {
                    return type;
                }
            }
        }
        return OTHER;
    }
}
