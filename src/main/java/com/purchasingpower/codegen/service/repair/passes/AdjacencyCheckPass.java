package com.purchasingpower.codegen.service.repair.passes;

import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.BooleanLiteralExpr;
import com.github.javaparser.ast.expr.CharLiteralExpr;
import com.github.javaparser.ast.expr.EnclosedExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.IntegerLiteralExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.StringLiteralExpr;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.IfStmt;
import com.github.javaparser.ast.stmt.ReturnStmt;
import com.github.javaparser.ast.stmt.Statement;
import com.purchasingpower.codegen.service.repair.RepairContext;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Pass 6. Strengthens an order-only comparison of the positions of two characters
 * (by default {@code '@'} and {@code '.'}) so that the two may not sit next to each other.
 *
 * <p>Reject form: {@code if (at > dot) return false;} becomes
 * {@code if (at >= dot || dot - at == 1) return false;}. Accept form: {@code at < dot}
 * becomes {@code (at < dot && dot - at > 1)}. Positions are recognised as direct
 * {@code indexOf}/{@code lastIndexOf} calls or variables assigned from one. Nothing is
 * rewritten when the method already subtracts one position from the other.
 */
public class AdjacencyCheckPass extends JavaRepairPass {

    static final List<String> DEFAULT_PAIR = List.of("@", ".");

    private static final Set<String> LOOKUP_METHODS = Set.of("indexOf", "lastIndexOf");

    @Override
    protected List<String> repairMethod(MethodDeclaration method, RepairContext context) {
        List<String> pair = context.adjacencyPair().orElse(DEFAULT_PAIR);
        Positions positions = new Positions(pair.get(0).charAt(0), pair.get(1).charAt(0), lookupVariables(method));

        if (hasDistanceCheck(method, positions)) {
            return List.of();
        }

        List<String> fixes = new ArrayList<>();
        for (IfStmt ifStmt : JavaRepairSupport.ownNodes(method, IfStmt.class)) {
            if (!(ifStmt.getCondition() instanceof BinaryExpr comparison) || !returnsFalse(ifStmt.getThenStmt())) {
                continue;
            }
            Optional<Operands> operands = positions.rejectOperands(comparison);
            if (operands.isPresent()) {
                ifStmt.setCondition(rejectCondition(operands.get()));
                fixes.add(describe(method, pair));
            }
        }
        for (BinaryExpr comparison : JavaRepairSupport.ownNodes(method, BinaryExpr.class)) {
            Optional<Operands> operands = positions.acceptOperands(comparison);
            if (operands.isPresent() && comparison.getParentNode().isPresent()) {
                comparison.replace(acceptCondition(comparison.clone(), operands.get()));
                fixes.add(describe(method, pair));
            }
        }
        return fixes;
    }

    private String describe(MethodDeclaration method, List<String> pair) {
        return String.format("Strengthened '%s'/'%s' order check in %s() to reject adjacent characters",
                pair.get(0), pair.get(1), method.getNameAsString());
    }

    private Expression rejectCondition(Operands operands) {
        BinaryExpr outOfOrder = new BinaryExpr(operands.first().clone(), operands.second().clone(),
                BinaryExpr.Operator.GREATER_EQUALS);
        BinaryExpr adjacent = new BinaryExpr(distance(operands), new IntegerLiteralExpr("1"), BinaryExpr.Operator.EQUALS);
        return new BinaryExpr(outOfOrder, adjacent, BinaryExpr.Operator.OR);
    }

    private Expression acceptCondition(BinaryExpr ordered, Operands operands) {
        BinaryExpr apart = new BinaryExpr(distance(operands), new IntegerLiteralExpr("1"), BinaryExpr.Operator.GREATER);
        return new EnclosedExpr(new BinaryExpr(ordered, apart, BinaryExpr.Operator.AND));
    }

    private BinaryExpr distance(Operands operands) {
        return new BinaryExpr(operands.second().clone(), operands.first().clone(), BinaryExpr.Operator.MINUS);
    }

    private boolean returnsFalse(Statement statement) {
        if (statement instanceof BlockStmt block) {
            return block.getStatements().size() == 1 && returnsFalse(block.getStatement(0));
        }
        return statement instanceof ReturnStmt returnStmt
                && returnStmt.getExpression()
                        .filter(e -> e instanceof BooleanLiteralExpr literal && !literal.getValue())
                        .isPresent();
    }

    private boolean hasDistanceCheck(MethodDeclaration method, Positions positions) {
        return !method.findAll(BinaryExpr.class, b -> b.getOperator() == BinaryExpr.Operator.MINUS
                && positions.lookup(b.getLeft()).isPresent()
                && positions.lookup(b.getRight()).isPresent()
                && !positions.lookup(b.getLeft()).equals(positions.lookup(b.getRight()))).isEmpty();
    }

    private Map<String, Character> lookupVariables(MethodDeclaration method) {
        Map<String, Character> variables = new HashMap<>();
        for (VariableDeclarator declarator : method.findAll(VariableDeclarator.class)) {
            declarator.getInitializer()
                    .flatMap(AdjacencyCheckPass::lookupCall)
                    .ifPresent(c -> variables.put(declarator.getNameAsString(), c));
        }
        for (AssignExpr assign : method.findAll(AssignExpr.class)) {
            if (assign.getTarget() instanceof NameExpr target) {
                lookupCall(assign.getValue()).ifPresent(c -> variables.put(target.getNameAsString(), c));
            }
        }
        return variables;
    }

    private static Optional<Character> lookupCall(Expression expression) {
        if (!(expression instanceof MethodCallExpr call)
                || !LOOKUP_METHODS.contains(call.getNameAsString())
                || call.getArguments().isEmpty()) {
            return Optional.empty();
        }
        Expression argument = call.getArgument(0);
        if (argument instanceof CharLiteralExpr literal) {
            return Optional.of(literal.asChar());
        }
        if (argument instanceof StringLiteralExpr literal && literal.asString().length() == 1) {
            return Optional.of(literal.asString().charAt(0));
        }
        return Optional.empty();
    }

    private record Operands(Expression first, Expression second) {
    }

    private record Positions(char first, char second, Map<String, Character> variables) {

        Optional<Character> lookup(Expression expression) {
            if (expression instanceof EnclosedExpr enclosed) {
                return lookup(enclosed.getInner());
            }
            if (expression instanceof NameExpr name) {
                return Optional.ofNullable(variables.get(name.getNameAsString()));
            }
            return lookupCall(expression);
        }

        Optional<Operands> rejectOperands(BinaryExpr comparison) {
            if (comparison.getOperator() == BinaryExpr.Operator.GREATER && is(comparison.getLeft(), first)
                    && is(comparison.getRight(), second)) {
                return Optional.of(new Operands(comparison.getLeft(), comparison.getRight()));
            }
            if (comparison.getOperator() == BinaryExpr.Operator.LESS && is(comparison.getLeft(), second)
                    && is(comparison.getRight(), first)) {
                return Optional.of(new Operands(comparison.getRight(), comparison.getLeft()));
            }
            return Optional.empty();
        }

        Optional<Operands> acceptOperands(BinaryExpr comparison) {
            if (comparison.getOperator() == BinaryExpr.Operator.LESS && is(comparison.getLeft(), first)
                    && is(comparison.getRight(), second)) {
                return Optional.of(new Operands(comparison.getLeft(), comparison.getRight()));
            }
            if (comparison.getOperator() == BinaryExpr.Operator.GREATER && is(comparison.getLeft(), second)
                    && is(comparison.getRight(), first)) {
                return Optional.of(new Operands(comparison.getRight(), comparison.getLeft()));
            }
            return Optional.empty();
        }

        private boolean is(Expression expression, char expected) {
            return lookup(expression).filter(c -> c == expected).isPresent();
        }
    }
}
