package com.purchasingpower.codegen.ast;

import java.util.List;
import java.util.Optional;

/**
 * Generic view of a node in a parsed candidate.
 *
 * <p>Structural checks are written against this interface only, so they run unchanged
 * for any host language that provides a {@link SourceParser}. Implementations are
 * lightweight views over the adapter's own tree and compare equal when they wrap the
 * same underlying node.
 *
 * @since 1.0.0
 */
public interface SourceNode {

    NodeKind getKind();

    List<SourceNode> getChildren();

    Optional<SourceNode> getParent();

    Optional<SourceRange> getRange();

    /**
     * Identifier carried by the node: declared name for functions, types and variables,
     * invoked name for calls, referenced name for names, target name for assignments.
     */
    Optional<String> getName();

    /**
     * Operator symbol for binary, unary and assignment nodes, e.g. {@code "<"}, {@code "++"}, {@code "+="}.
     */
    Optional<String> getOperator();

    /**
     * Source text of the node as re-printed by the adapter.
     */
    String getText();

    default boolean is(NodeKind kind) {
        return getKind() == kind;
    }

    default boolean hasName(String name) {
        return getName().map(name::equals).orElse(false);
    }

    default Integer getLine() {
        return getRange().map(SourceRange::getBeginLine).orElse(null);
    }
}
