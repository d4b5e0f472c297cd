package com.purchasingpower.codegen.service.repair.passes;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.VariableDeclarationExpr;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.BreakStmt;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import com.github.javaparser.ast.stmt.IfStmt;
import com.github.javaparser.ast.stmt.ReturnStmt;
import com.github.javaparser.ast.stmt.Statement;
import com.github.javaparser.ast.stmt.SwitchStmt;
import com.purchasingpower.codegen.service.repair.RepairContext;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Pass 8. Turns a "remember the last match" loop into a "return the first match" loop.
 *
 * <pre>
 * int result = -1;                       for (...) {
 * for (...) {                               if (cond) {
 *     if (cond) {                               return i;
 *         result = i;            ==&gt;          }
 *     }                                     }
 * }                                         return -1;
 * return result;
 * </pre>
 *
 * <p>Applies only when the sentinel is initialised with a constant, reassigned solely as
 * the last statement of a conditional branch inside one top-level loop without
 * {@code break}, returned unchanged after that loop and read nowhere else. Stands down
 * when the attached constraints ask for accumulation.
 */
@Slf4j
public class LoopEarlyReturnPass extends JavaRepairPass {

    @Override
    protected List<String> repairMethod(MethodDeclaration method, RepairContext context) {
        if (context.requiresAccumulation()) {
            log.debug("Skipping early-return conversion in {}(): accumulation required", method.getNameAsString());
            return List.of();
        }
        BlockStmt body = method.getBody().orElseThrow();
        NodeList<Statement> statements = body.getStatements();

        for (int declIndex = 0; declIndex < statements.size(); declIndex++) {
            Optional<VariableDeclarator> sentinel = sentinel(statements.get(declIndex));
            if (sentinel.isEmpty()) {
                continue;
            }
            Optional<String> fix = convert(method, statements, declIndex, sentinel.get());
            if (fix.isPresent()) {
                return List.of(fix.get());
            }
        }
        return List.of();
    }

    private Optional<String> convert(MethodDeclaration method, NodeList<Statement> statements, int declIndex,
                                     VariableDeclarator sentinel) {
        String name = sentinel.getNameAsString();
        for (int loopIndex = declIndex + 1; loopIndex < statements.size(); loopIndex++) {
            Statement loop = statements.get(loopIndex);
            if (!loop.isForStmt() && !loop.isForEachStmt() && !loop.isWhileStmt() && !loop.isDoStmt()) {
                continue;
            }
            List<AssignExpr> assignments = loop.findAll(AssignExpr.class, a -> targets(a, name));
            if (assignments.isEmpty()) {
                continue;
            }
            Optional<ReturnStmt> finalReturn = returnAfter(statements, loopIndex, name);
            if (finalReturn.isEmpty() || hasBreak(loop)
                    || !assignments.stream().allMatch(this::isConditionalTail)
                    || countReferences(method, name) != assignments.size() + 1) {
                return Optional.empty();
            }

            Expression initial = sentinel.getInitializer().orElseThrow().clone();
            for (AssignExpr assignment : assignments) {
                assignment.getParentNode().orElseThrow()
                        .replace(new ReturnStmt(assignment.getValue().clone()));
            }
            finalReturn.get().setExpression(initial);
            statements.get(declIndex).remove();
            return Optional.of(String.format(
                    "Converted sentinel '%s' loop in %s() to early return (returns FIRST match, not last)",
                    name, method.getNameAsString()));
        }
        return Optional.empty();
    }

    private Optional<VariableDeclarator> sentinel(Statement statement) {
        if (!(statement instanceof ExpressionStmt expressionStmt)
                || !(expressionStmt.getExpression() instanceof VariableDeclarationExpr declaration)
                || declaration.getVariables().size() != 1) {
            return Optional.empty();
        }
        VariableDeclarator variable = declaration.getVariable(0);
        return variable.getInitializer().filter(this::isConstant).map(init -> variable);
    }

    private boolean isConstant(Expression expression) {
        if (expression.isLiteralExpr()) {
            return true;
        }
        return expression.isUnaryExpr() && expression.asUnaryExpr().getExpression().isLiteralExpr();
    }

    private boolean targets(AssignExpr assignment, String name) {
        return assignment.getTarget() instanceof NameExpr target && target.getNameAsString().equals(name);
    }

    /**
     * Plain assignment that is the last statement of an if/else branch.
     */
    private boolean isConditionalTail(AssignExpr assignment) {
        if (assignment.getOperator() != AssignExpr.Operator.ASSIGN
                || !(assignment.getParentNode().orElse(null) instanceof ExpressionStmt statement)) {
            return false;
        }
        Node parent = statement.getParentNode().orElse(null);
        if (parent instanceof IfStmt) {
            return true;
        }
        if (parent instanceof BlockStmt block && block.getParentNode().orElse(null) instanceof IfStmt) {
            return block.getStatements().getLast().filter(last -> last == statement).isPresent();
        }
        return false;
    }

    private Optional<ReturnStmt> returnAfter(NodeList<Statement> statements, int loopIndex, String name) {
        for (int i = loopIndex + 1; i < statements.size(); i++) {
            if (statements.get(i) instanceof ReturnStmt returnStmt) {
                boolean returnsSentinel = returnStmt.getExpression()
                        .filter(e -> e instanceof NameExpr n && n.getNameAsString().equals(name))
                        .isPresent();
                return returnsSentinel ? Optional.of(returnStmt) : Optional.empty();
            }
        }
        return Optional.empty();
    }

    private boolean hasBreak(Statement loop) {
        List<BreakStmt> breaks = new ArrayList<>(loop.findAll(BreakStmt.class));
        breaks.removeIf(b -> b.getLabel().isEmpty() && b.findAncestor(SwitchStmt.class)
                .filter(loop::isAncestorOf).isPresent());
        return !breaks.isEmpty();
    }

    private int countReferences(MethodDeclaration method, String name) {
        return method.findAll(NameExpr.class, n -> n.getNameAsString().equals(name)).size();
    }
}
