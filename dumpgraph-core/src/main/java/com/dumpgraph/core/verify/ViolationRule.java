package com.dumpgraph.core.verify;

/**
 * Structural invariant a resolved configuration must satisfy.
 */
public enum ViolationRule {
    /**
     * {@code previous} and {@code next} form one strict sequence in list order.
     */
    TOKEN_SEQUENCE,

    /**
     * A token is the operand of at most one other token.
     */
    AST_PARENT,

    /**
     * Following {@code astParent} from any token ends at a root.
     */
    AST_CYCLE,

    /**
     * Exactly one scope has no enclosing scope, and it is the global scope.
     */
    SCOPE_ROOT,

    /**
     * Following {@code nestedIn} from any scope ends at the root.
     */
    SCOPE_CYCLE
}
