package com.purchasingpower.codegen.service.repair.passes;

import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.BooleanLiteralExpr;
import com.github.javaparser.ast.expr.EnclosedExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.UnaryExpr;
import com.purchasingpower.codegen.service.repair.RepairContext;

import java.util.ArrayList;
import java.util.List;

/**
 * Pass 3. Drops comparisons against boolean literals: {@code x == true} and
 * {@code x != false} become {@code x}; {@code x == false} and {@code x != true} become
 * {@code !x}. Either operand order is recognised.
 */
public class BooleanComparisonPass extends JavaRepairPass {

    @Override
    protected List<String> repairMethod(MethodDeclaration method, RepairContext context) {
        List<String> fixes = new ArrayList<>();
        for (BinaryExpr comparison : method.findAll(BinaryExpr.class, this::isLiteralComparison)) {
            if (comparison.getParentNode().isEmpty()) {
                continue;
            }
            boolean literalOnRight = comparison.getRight() instanceof BooleanLiteralExpr;
            boolean literal = ((BooleanLiteralExpr) (literalOnRight ? comparison.getRight() : comparison.getLeft())).getValue();
            Expression operand = literalOnRight ? comparison.getLeft() : comparison.getRight();

            boolean positive = (comparison.getOperator() == BinaryExpr.Operator.EQUALS) == literal;
            String before = comparison.toString();
            Expression replacement = positive
                    ? operand
                    : new UnaryExpr(parenthesize(operand), UnaryExpr.Operator.LOGICAL_COMPLEMENT);
            comparison.replace(replacement);
            fixes.add(String.format("Simplified '%s' to '%s'", before, replacement));
        }
        return fixes;
    }

    private boolean isLiteralComparison(BinaryExpr expr) {
        BinaryExpr.Operator operator = expr.getOperator();
        if (operator != BinaryExpr.Operator.EQUALS && operator != BinaryExpr.Operator.NOT_EQUALS) {
            return false;
        }
        return expr.getLeft() instanceof BooleanLiteralExpr ^ expr.getRight() instanceof BooleanLiteralExpr;
    }

    private Expression parenthesize(Expression operand) {
        if (operand.isNameExpr() || operand.isMethodCallExpr() || operand.isFieldAccessExpr()
                || operand.isArrayAccessExpr() || operand.isEnclosedExpr()) {
            return operand;
        }
        return new EnclosedExpr(operand);
    }
}
