package com.purchasingpower.codegen.ast;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Traversal helpers over {@link SourceNode} trees.
 */
public final class SourceNodes {

    private SourceNodes() {
    }

    /**
     * All descendants of {@code root} in pre-order, excluding {@code root} itself.
     */
    public static Stream<SourceNode> all(SourceNode root) {
        return collect(root, false).stream();
    }

    /**
     * Descendants of {@code root} that execute in its own scope. Nested lambdas, local or
     * anonymous types and their functions are reported but not entered.
     */
    public static Stream<SourceNode> scope(SourceNode root) {
        return collect(root, true).stream();
    }

    public static List<SourceNode> scopeOfKind(SourceNode root, NodeKind kind) {
        List<SourceNode> result = new ArrayList<>();
        scope(root).filter(node -> node.is(kind)).forEach(result::add);
        return result;
    }

    public static boolean isDescendantOf(SourceNode node, SourceNode ancestor) {
        Optional<SourceNode> current = node.getParent();
        while (current.isPresent()) {
            if (current.get().equals(ancestor)) {
                return true;
            }
            current = current.get().getParent();
        }
        return false;
    }

    /**
     * Whether {@code node} starts after {@code other} ends. Nodes without ranges never compare as after.
     */
    public static boolean isAfter(SourceNode node, SourceNode other) {
        Optional<SourceRange> a = node.getRange();
        Optional<SourceRange> b = other.getRange();
        if (a.isEmpty() || b.isEmpty()) {
            return false;
        }
        SourceRange mine = a.get();
        SourceRange theirs = b.get();
        return mine.getBeginLine() > theirs.getEndLine()
                || (mine.getBeginLine() == theirs.getEndLine() && mine.getBeginColumn() > theirs.getEndColumn());
    }

    private static List<SourceNode> collect(SourceNode root, boolean stopAtScopes) {
        List<SourceNode> out = new ArrayList<>();
        Deque<SourceNode> stack = new ArrayDeque<>();
        pushChildren(stack, root);
        while (!stack.isEmpty()) {
            SourceNode node = stack.pop();
            out.add(node);
            if (stopAtScopes && node.getKind().isOpaqueScope()) {
                continue;
            }
            pushChildren(stack, node);
        }
        return out;
    }

    private static void pushChildren(Deque<SourceNode> stack, SourceNode node) {
        List<SourceNode> children = node.getChildren();
        for (int i = children.size() - 1; i >= 0; i--) {
            stack.push(children.get(i));
        }
    }
}
