package com.purchasingpower.codegen.ast;

import java.util.Optional;

/**
 * A successfully parsed candidate.
 */
public interface ParsedSource {

    SourceNode getRoot();

    /**
     * First function declaration with the given name, searching nested types as well.
     */
    default Optional<SourceNode> findFunction(String name) {
        return SourceNodes.all(getRoot())
                .filter(node -> node.is(NodeKind.FUNCTION) && node.hasName(name))
                .findFirst();
    }

    /**
     * Prints the (possibly rewritten) tree back to source in the shape it was submitted.
     */
    String print();
}
