package com.purchasingpower.codegen.ast;

/**
 * Language-neutral classification of source AST nodes.
 *
 * <p>Each host-language adapter maps its own node types onto these kinds. Anything the
 * structural checks do not need to distinguish is {@link #OTHER}.
 */
public enum NodeKind {
    COMPILATION_UNIT,
    TYPE_DECLARATION,
    FUNCTION,
    BLOCK,
    RETURN,
    THROW,
    BREAK,
    LOOP,
    CONDITIONAL,
    ASSIGNMENT,
    VARIABLE_DECLARATION,
    METHOD_CALL,
    BINARY,
    UNARY,
    LITERAL,
    NULL_LITERAL,
    NAME,
    LAMBDA,
    EXPRESSION_STATEMENT,
    OTHER;

    /**
     * Kinds that open a new executable scope. Returns inside them do not return from the
     * enclosing function.
     */
    public boolean isOpaqueScope() {
        return this == LAMBDA || this == TYPE_DECLARATION || this == FUNCTION;
    }
}
