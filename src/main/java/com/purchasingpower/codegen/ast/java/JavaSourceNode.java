package com.purchasingpower.codegen.ast.java;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Modifier;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.comments.Comment;
import com.github.javaparser.ast.expr.AnnotationExpr;
import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.ConditionalExpr;
import com.github.javaparser.ast.expr.FieldAccessExpr;
import com.github.javaparser.ast.expr.LambdaExpr;
import com.github.javaparser.ast.expr.LiteralExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.Name;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.NullLiteralExpr;
import com.github.javaparser.ast.expr.SimpleName;
import com.github.javaparser.ast.expr.UnaryExpr;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.BreakStmt;
import com.github.javaparser.ast.stmt.DoStmt;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import com.github.javaparser.ast.stmt.ForEachStmt;
import com.github.javaparser.ast.stmt.ForStmt;
import com.github.javaparser.ast.stmt.IfStmt;
import com.github.javaparser.ast.stmt.ReturnStmt;
import com.github.javaparser.ast.stmt.SwitchStmt;
import com.github.javaparser.ast.stmt.ThrowStmt;
import com.github.javaparser.ast.stmt.WhileStmt;
import com.github.javaparser.ast.type.Type;
import com.purchasingpower.codegen.ast.NodeKind;
import com.purchasingpower.codegen.ast.SourceNode;
import com.purchasingpower.codegen.ast.SourceRange;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@link SourceNode} view over a JavaParser node.
 *
 * <p>Type references, modifiers, annotations, comments and bare identifiers are hidden
 * from {@link #getChildren()}; they carry no control or data flow the checks look at.
 */
public final class JavaSourceNode implements SourceNode {

    private final Node node;
    private final int lineOffset;

    JavaSourceNode(Node node, int lineOffset) {
        this.node = node;
        this.lineOffset = lineOffset;
    }

    public Node unwrap() {
        return node;
    }

    @Override
    public NodeKind getKind() {
        return classify(node);
    }

    @Override
    public List<SourceNode> getChildren() {
        List<SourceNode> children = new ArrayList<>();
        for (Node child : node.getChildNodes()) {
            if (isStructural(child)) {
                children.add(new JavaSourceNode(child, lineOffset));
            }
        }
        return children;
    }

    @Override
    public Optional<SourceNode> getParent() {
        return node.getParentNode().map(parent -> new JavaSourceNode(parent, lineOffset));
    }

    @Override
    public Optional<SourceRange> getRange() {
        return node.getRange().map(r -> new SourceRange(
                r.begin.line - lineOffset, r.begin.column, r.end.line - lineOffset, r.end.column));
    }

    @Override
    public Optional<String> getName() {
        if (node instanceof MethodDeclaration n) {
            return Optional.of(n.getNameAsString());
        }
        if (node instanceof MethodCallExpr n) {
            return Optional.of(n.getNameAsString());
        }
        if (node instanceof NameExpr n) {
            return Optional.of(n.getNameAsString());
        }
        if (node instanceof VariableDeclarator n) {
            return Optional.of(n.getNameAsString());
        }
        if (node instanceof Parameter n) {
            return Optional.of(n.getNameAsString());
        }
        if (node instanceof TypeDeclaration<?> n) {
            return Optional.of(n.getNameAsString());
        }
        if (node instanceof FieldAccessExpr n) {
            return Optional.of(n.getNameAsString());
        }
        if (node instanceof ForEachStmt n) {
            return Optional.of(n.getVariableDeclarator().getNameAsString());
        }
        if (node instanceof AssignExpr n) {
            return simpleName(n.getTarget());
        }
        if (node instanceof UnaryExpr n) {
            return simpleName(n.getExpression());
        }
        return Optional.empty();
    }

    @Override
    public Optional<String> getOperator() {
        if (node instanceof BinaryExpr n) {
            return Optional.of(n.getOperator().asString());
        }
        if (node instanceof UnaryExpr n) {
            return Optional.of(n.getOperator().asString());
        }
        if (node instanceof AssignExpr n) {
            return Optional.of(n.getOperator().asString());
        }
        return Optional.empty();
    }

    @Override
    public String getText() {
        return node.toString();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof JavaSourceNode && ((JavaSourceNode) o).node == node;
    }

    @Override
    public int hashCode() {
        return System.identityHashCode(node);
    }

    @Override
    public String toString() {
        return getKind() + "[" + getText() + "]";
    }

    static NodeKind classify(Node node) {
        if (node instanceof CompilationUnit) {
            return NodeKind.COMPILATION_UNIT;
        }
        if (node instanceof TypeDeclaration) {
            return NodeKind.TYPE_DECLARATION;
        }
        if (node instanceof MethodDeclaration) {
            return NodeKind.FUNCTION;
        }
        if (node instanceof BlockStmt) {
            return NodeKind.BLOCK;
        }
        if (node instanceof ReturnStmt) {
            return NodeKind.RETURN;
        }
        if (node instanceof ThrowStmt) {
            return NodeKind.THROW;
        }
        if (node instanceof BreakStmt) {
            return NodeKind.BREAK;
        }
        if (node instanceof ForStmt || node instanceof ForEachStmt
                || node instanceof WhileStmt || node instanceof DoStmt) {
            return NodeKind.LOOP;
        }
        if (node instanceof IfStmt || node instanceof ConditionalExpr || node instanceof SwitchStmt) {
            return NodeKind.CONDITIONAL;
        }
        if (node instanceof AssignExpr) {
            return NodeKind.ASSIGNMENT;
        }
        if (node instanceof VariableDeclarator) {
            return NodeKind.VARIABLE_DECLARATION;
        }
        if (node instanceof MethodCallExpr) {
            return NodeKind.METHOD_CALL;
        }
        if (node instanceof BinaryExpr) {
            return NodeKind.BINARY;
        }
        if (node instanceof UnaryExpr) {
            return NodeKind.UNARY;
        }
        if (node instanceof NullLiteralExpr) {
            return NodeKind.NULL_LITERAL;
        }
        if (node instanceof LiteralExpr) {
            return NodeKind.LITERAL;
        }
        if (node instanceof NameExpr) {
            return NodeKind.NAME;
        }
        if (node instanceof LambdaExpr) {
            return NodeKind.LAMBDA;
        }
        if (node instanceof ExpressionStmt) {
            return NodeKind.EXPRESSION_STATEMENT;
        }
        return NodeKind.OTHER;
    }

    private static boolean isStructural(Node child) {
        return !(child instanceof SimpleName)
                && !(child instanceof Name)
                && !(child instanceof Type)
                && !(child instanceof Modifier)
                && !(child instanceof AnnotationExpr)
                && !(child instanceof Comment);
    }

    private static Optional<String> simpleName(Node target) {
        if (target instanceof NameExpr name) {
            return Optional.of(name.getNameAsString());
        }
        return Optional.empty();
    }
}
