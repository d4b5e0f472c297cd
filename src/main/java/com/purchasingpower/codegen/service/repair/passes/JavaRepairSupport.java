package com.purchasingpower.codegen.service.repair.passes;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.expr.LambdaExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.expr.SimpleName;

import java.util.List;

final class JavaRepairSupport {

    private JavaRepairSupport() {
    }

    /**
     * Nodes of {@code type} that belong to {@code method} itself, excluding those inside
     * lambdas, anonymous classes and local types.
     */
    static <T extends Node> List<T> ownNodes(MethodDeclaration method, Class<T> type) {
        return method.findAll(type, node -> isOwnedBy(node, method));
    }

    static boolean isOwnedBy(Node node, MethodDeclaration method) {
        Node current = node.getParentNode().orElse(null);
        while (current != null) {
            if (current == method) {
                return true;
            }
            if (current instanceof MethodDeclaration
                    || current instanceof LambdaExpr
                    || current instanceof TypeDeclaration<?>
                    || current instanceof ObjectCreationExpr creation && creation.getAnonymousClassBody().isPresent()) {
                return false;
            }
            current = current.getParentNode().orElse(null);
        }
        return false;
    }

    /**
     * Whether any identifier in the method, parameters included, is already {@code name}.
     */
    static boolean isNameTaken(MethodDeclaration method, String name) {
        return !method.findAll(SimpleName.class, n -> n.getIdentifier().equals(name)).isEmpty();
    }
}
