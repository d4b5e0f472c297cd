package com.purchasingpower.codegen.service.repair.passes;

import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.UnaryExpr;
import com.github.javaparser.ast.expr.VariableDeclarationExpr;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import com.github.javaparser.ast.stmt.ReturnStmt;
import com.github.javaparser.ast.stmt.Statement;
import com.purchasingpower.codegen.service.repair.RepairContext;

import java.util.List;
import java.util.Optional;

/**
 * Pass 7. A non-void method without any {@code return} that ends in an expression gets
 * one: a trailing assignment, declaration or increment of a name is followed by
 * {@code return name;}, any other trailing expression is itself returned. Console output
 * is never turned into a return value.
 */
public class MissingReturnPass extends JavaRepairPass {

    @Override
    protected List<String> repairMethod(MethodDeclaration method, RepairContext context) {
        if (method.getType().isVoidType() || !JavaRepairSupport.ownNodes(method, ReturnStmt.class).isEmpty()) {
            return List.of();
        }
        BlockStmt body = method.getBody().orElseThrow();
        NodeList<Statement> statements = body.getStatements();
        if (statements.isEmpty() || !(statements.getLast().orElseThrow() instanceof ExpressionStmt last)) {
            return List.of();
        }

        Expression expression = last.getExpression();
        Optional<String> assigned = assignedName(expression);
        if (assigned.isPresent()) {
            body.addStatement(new ReturnStmt(new NameExpr(assigned.get())));
            return List.of(String.format("Added missing 'return %s;' at end of %s()",
                    assigned.get(), method.getNameAsString()));
        }
        if (expression instanceof VariableDeclarationExpr || isConsoleOutput(expression)) {
            return List.of();
        }
        last.replace(new ReturnStmt(expression.clone()));
        return List.of(String.format("Converted final expression '%s' into a return in %s()",
                expression, method.getNameAsString()));
    }

    private Optional<String> assignedName(Expression expression) {
        if (expression instanceof AssignExpr assign && assign.getTarget() instanceof NameExpr target) {
            return Optional.of(target.getNameAsString());
        }
        if (expression instanceof UnaryExpr unary && unary.getExpression() instanceof NameExpr target
                && isIncrement(unary.getOperator())) {
            return Optional.of(target.getNameAsString());
        }
        if (expression instanceof VariableDeclarationExpr declaration && declaration.getVariables().size() == 1) {
            VariableDeclarator variable = declaration.getVariable(0);
            if (variable.getInitializer().isPresent()) {
                return Optional.of(variable.getNameAsString());
            }
        }
        return Optional.empty();
    }

    private boolean isIncrement(UnaryExpr.Operator operator) {
        return operator == UnaryExpr.Operator.POSTFIX_INCREMENT
                || operator == UnaryExpr.Operator.PREFIX_INCREMENT
                || operator == UnaryExpr.Operator.POSTFIX_DECREMENT
                || operator == UnaryExpr.Operator.PREFIX_DECREMENT;
    }

    private boolean isConsoleOutput(Expression expression) {
        if (!(expression instanceof MethodCallExpr call)) {
            return false;
        }
        String scope = call.getScope().map(Expression::toString).orElse("");
        return scope.equals("System.out") || scope.equals("System.err");
    }
}
