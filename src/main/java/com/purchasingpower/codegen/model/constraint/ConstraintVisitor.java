package com.purchasingpower.codegen.model.constraint;

/**
 * Exhaustive dispatch over the constraint variants.
 *
 * @param <R> result type
 */
public interface ConstraintVisitor<R> {

    R visitReturn(ReturnConstraint constraint);

    R visitLoopBehavior(LoopBehaviorConstraint constraint);

    R visitPosition(PositionConstraint constraint);
}
