package com.purchasingpower.codegen.service.validation;

import com.purchasingpower.codegen.ast.NodeKind;
import com.purchasingpower.codegen.ast.SourceNode;
import com.purchasingpower.codegen.ast.SourceNodes;
import com.purchasingpower.codegen.model.constraint.ConstraintViolation;
import com.purchasingpower.codegen.model.constraint.ConstraintVisitor;
import com.purchasingpower.codegen.model.constraint.LoopBehaviorConstraint;
import com.purchasingpower.codegen.model.constraint.LoopRequirement;
import com.purchasingpower.codegen.model.constraint.PositionConstraint;
import com.purchasingpower.codegen.model.constraint.PositionRequirement;
import com.purchasingpower.codegen.model.constraint.ReturnConstraint;
import com.purchasingpower.codegen.model.constraint.ReturnRequirement;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Structural checks for one function, one per constraint variant.
 *
 * <p>Everything here is expressed over {@link SourceNode}, so the checks are independent
 * of the host language. Nested lambdas and local types are not entered: a return inside
 * them does not leave the function under test.
 */
class StructuralChecks implements ConstraintVisitor<List<ConstraintViolation>> {

    private static final Set<String> RELATIONAL = Set.of("<", ">", "<=", ">=", "==", "!=");
    private static final Set<String> ORDERING = Set.of("<", ">", "<=", ">=");
    private static final Set<String> STREAM_CALLS = Set.of(
            "stream", "findFirst", "findAny", "anyMatch", "allMatch", "noneMatch",
            "collect", "toList", "reduce", "range", "rangeClosed");
    private static final Set<String> ACCUMULATING_CALLS = Set.of(
            "add", "addAll", "addFirst", "addLast", "append", "put", "push", "offer", "merge");
    private static final Set<String> POSITION_CALLS = Set.of("indexOf", "lastIndexOf");
    private static final Set<String> REGEX_CALLS = Set.of("matches", "matcher", "compile", "replaceAll", "split");
    private static final Set<String> STACK_CALLS = Set.of("push", "pop");

    private final SourceNode function;

    StructuralChecks(SourceNode function) {
        this.function = function;
    }

    @Override
    public List<ConstraintViolation> visitReturn(ReturnConstraint constraint) {
        if (constraint.getRequirement() != ReturnRequirement.MUST_RETURN) {
            return List.of();
        }
        List<SourceNode> returns = SourceNodes.scopeOfKind(function, NodeKind.RETURN);
        if (returns.isEmpty()) {
            return List.of(ConstraintViolation.of(constraint,
                    String.format("No return statement found. Expected to return '%s'", constraint.getValueName()),
                    function.getLine()));
        }
        boolean returnsValue = returns.stream().anyMatch(StructuralChecks::yieldsValue);
        if (!returnsValue) {
            return List.of(ConstraintViolation.of(constraint,
                    String.format("All return statements return null. Expected to return '%s'", constraint.getValueName()),
                    returns.get(0).getLine()));
        }
        return List.of();
    }

    @Override
    public List<ConstraintViolation> visitLoopBehavior(LoopBehaviorConstraint constraint) {
        List<SourceNode> loops = SourceNodes.scopeOfKind(function, NodeKind.LOOP);
        String searchType = constraint.getSearchType().wireValue();

        if (loops.isEmpty()) {
            if (usesStreamPipeline()) {
                return List.of();
            }
            return List.of(ConstraintViolation.of(constraint,
                    String.format("No loop found, but constraint requires %s pattern", searchType),
                    function.getLine()));
        }

        boolean returnsInsideLoop = loops.stream().anyMatch(loop -> containsInScope(loop, NodeKind.RETURN));

        if (constraint.getRequirement() == LoopRequirement.EARLY_RETURN) {
            if (!returnsInsideLoop) {
                return List.of(ConstraintViolation.of(constraint,
                        "FIRST_MATCH requires early return inside loop, but no return found in loop body",
                        loops.get(0).getLine()));
            }
            return List.of();
        }

        if (returnsInsideLoop) {
            return List.of(ConstraintViolation.of(constraint,
                    String.format("%s requires accumulation, but found early return in loop", searchType),
                    loops.get(0).getLine()));
        }
        boolean accumulates = loops.stream().anyMatch(loop -> accumulatesInto(loop) && returnsAfter(loop));
        if (!accumulates) {
            return List.of(ConstraintViolation.of(constraint,
                    String.format("%s requires accumulation, but no accumulation into a variable returned after the loop was found",
                            searchType),
                    loops.get(0).getLine()));
        }
        return List.of();
    }

    @Override
    public List<ConstraintViolation> visitPosition(PositionConstraint constraint) {
        if (callsAny(REGEX_CALLS)) {
            // pattern-based validation cannot be inspected structurally
            return List.of();
        }
        PositionRequirement requirement = constraint.getRequirement();
        if (requirement.isDistanceBased()) {
            if (hasDistanceCheck()) {
                return List.of();
            }
            return List.of(ConstraintViolation.of(constraint, distanceMessage(constraint), function.getLine()));
        }
        if (hasOrderingCheck()) {
            return List.of();
        }
        return List.of(ConstraintViolation.of(constraint,
                String.format("Constraint requires %s, but no ordering check found", constraint.describeElements(" before ")),
                function.getLine()));
    }

    private static String distanceMessage(PositionConstraint constraint) {
        String elements = constraint.describeElements(" and ");
        switch (constraint.getRequirement()) {
            case MIN_DISTANCE:
                return String.format("Constraint requires %s to be at least %d characters apart, but no distance check found",
                        elements, constraint.getMinDistance());
            case MAX_DISTANCE:
                return String.format("Constraint requires %s to be at most %s characters apart, but no distance check found",
                        elements, constraint.getMaxDistance());
            default:
                return String.format("Constraint requires %s to not be adjacent, but no position checking found", elements);
        }
    }

    private static boolean yieldsValue(SourceNode returnNode) {
        List<SourceNode> children = returnNode.getChildren();
        return !children.isEmpty() && !children.get(0).is(NodeKind.NULL_LITERAL);
    }

    private static boolean containsInScope(SourceNode root, NodeKind kind) {
        return SourceNodes.scope(root).anyMatch(node -> node.is(kind));
    }

    private static boolean matches(SourceNode root, Predicate<SourceNode> predicate) {
        return predicate.test(root) || SourceNodes.scope(root).anyMatch(predicate);
    }

    private boolean usesStreamPipeline() {
        return callsAny(STREAM_CALLS) || containsInScope(function, NodeKind.LAMBDA);
    }

    private boolean callsAny(Set<String> names) {
        return SourceNodes.all(function)
                .anyMatch(node -> node.is(NodeKind.METHOD_CALL) && node.getName().map(names::contains).orElse(false));
    }

    /**
     * Collection insertion, or assignment / increment of a variable declared before the loop.
     */
    private boolean accumulatesInto(SourceNode loop) {
        Set<String> outerVariables = new HashSet<>();
        SourceNodes.scope(function)
                .filter(node -> node.is(NodeKind.VARIABLE_DECLARATION))
                .filter(node -> !SourceNodes.isDescendantOf(node, loop))
                .forEach(node -> node.getName().ifPresent(outerVariables::add));

        return SourceNodes.scope(loop).anyMatch(node -> {
            if (node.is(NodeKind.METHOD_CALL)) {
                return node.getName().map(ACCUMULATING_CALLS::contains).orElse(false);
            }
            if (node.is(NodeKind.ASSIGNMENT)) {
                return node.getName().map(outerVariables::contains).orElse(false);
            }
            if (node.is(NodeKind.UNARY) && node.getOperator().map(op -> op.equals("++") || op.equals("--")).orElse(false)) {
                return node.getName().map(outerVariables::contains).orElse(false);
            }
            return false;
        });
    }

    private boolean returnsAfter(SourceNode loop) {
        return SourceNodes.scopeOfKind(function, NodeKind.RETURN).stream()
                .anyMatch(ret -> SourceNodes.isAfter(ret, loop) && yieldsValue(ret));
    }

    /**
     * A relational comparison over a position difference, {@code Math.abs(...)}, a variable
     * holding such a difference, a neighbouring {@code charAt(i + 1)} lookup, or an
     * offset search such as {@code indexOf('.', at + 2)}.
     */
    private boolean hasDistanceCheck() {
        Predicate<SourceNode> difference = node ->
                (node.is(NodeKind.BINARY) && node.getOperator().map("-"::equals).orElse(false))
                        || (node.is(NodeKind.METHOD_CALL) && node.hasName("abs"));
        Set<String> distanceVariables = variablesInitialisedWith(difference);

        Predicate<SourceNode> distanceOperand = node -> difference.test(node)
                || (node.is(NodeKind.NAME) && node.getName().map(distanceVariables::contains).orElse(false));

        boolean comparesDistance = SourceNodes.scope(function)
                .filter(node -> isComparison(node, RELATIONAL))
                .anyMatch(node -> matches(node, distanceOperand));
        if (comparesDistance) {
            return true;
        }

        return SourceNodes.scope(function)
                .filter(node -> node.is(NodeKind.METHOD_CALL)
                        && (node.hasName("charAt") || POSITION_CALLS.contains(node.getName().orElse(""))))
                .anyMatch(call -> call.getChildren().stream()
                        .skip(call.hasName("charAt") ? 0 : 1)
                        .anyMatch(arg -> arg.is(NodeKind.BINARY)
                                && arg.getOperator().map(op -> op.equals("+") || op.equals("-")).orElse(false)));
    }

    /**
     * A {@code <}/{@code >} comparison involving a position lookup or a variable holding
     * one, or a stack / depth-counter discipline.
     */
    private boolean hasOrderingCheck() {
        Predicate<SourceNode> lookup = node -> node.is(NodeKind.METHOD_CALL)
                && node.getName().map(POSITION_CALLS::contains).orElse(false);
        Set<String> positionVariables = variablesInitialisedWith(lookup);

        Predicate<SourceNode> positionOperand = node -> lookup.test(node)
                || (node.is(NodeKind.NAME) && node.getName().map(positionVariables::contains).orElse(false));

        boolean comparesPositions = SourceNodes.scope(function)
                .filter(node -> isComparison(node, ORDERING))
                .anyMatch(node -> matches(node, positionOperand));
        if (comparesPositions || callsAny(STACK_CALLS)) {
            return true;
        }

        Set<String> counters = new HashSet<>();
        SourceNodes.scope(function)
                .filter(node -> node.is(NodeKind.UNARY)
                        && node.getOperator().map(op -> op.equals("++") || op.equals("--")).orElse(false))
                .forEach(node -> node.getName().ifPresent(counters::add));
        return SourceNodes.scope(function)
                .filter(node -> isComparison(node, RELATIONAL))
                .anyMatch(node -> node.getChildren().stream()
                        .anyMatch(operand -> operand.is(NodeKind.NAME)
                                && operand.getName().map(counters::contains).orElse(false)));
    }

    private Set<String> variablesInitialisedWith(Predicate<SourceNode> predicate) {
        Set<String> names = new HashSet<>();
        SourceNodes.scope(function)
                .filter(node -> node.is(NodeKind.VARIABLE_DECLARATION) || node.is(NodeKind.ASSIGNMENT))
                .forEach(node -> {
                    List<SourceNode> children = node.getChildren();
                    if (children.isEmpty()) {
                        return;
                    }
                    SourceNode value = children.get(children.size() - 1);
                    if (matches(value, predicate)) {
                        node.getName().ifPresent(names::add);
                    }
                });
        return names;
    }

    private static boolean isComparison(SourceNode node, Set<String> operators) {
        return node.is(NodeKind.BINARY) && node.getOperator().map(operators::contains).orElse(false);
    }
}
