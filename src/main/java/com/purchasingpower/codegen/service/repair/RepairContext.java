package com.purchasingpower.codegen.service.repair;

import com.purchasingpower.codegen.model.constraint.Constraint;
import com.purchasingpower.codegen.model.constraint.LoopBehaviorConstraint;
import com.purchasingpower.codegen.model.constraint.LoopRequirement;
import com.purchasingpower.codegen.model.constraint.PositionConstraint;
import com.purchasingpower.codegen.model.constraint.PositionRequirement;
import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * What the repair passes may know about the intended behavior. Passes whose rewrite
 * would contradict an attached constraint consult it and stand down.
 */
@Value
public class RepairContext {

    private static final RepairContext EMPTY = new RepairContext(List.of());

    List<Constraint> constraints;

    public static RepairContext empty() {
        return EMPTY;
    }

    public static RepairContext of(List<Constraint> constraints) {
        return constraints == null || constraints.isEmpty() ? EMPTY : new RepairContext(List.copyOf(constraints));
    }

    /**
     * Whether an attached loop constraint requires the loop to keep going after a match.
     */
    public boolean requiresAccumulation() {
        return constraints.stream()
                .filter(LoopBehaviorConstraint.class::isInstance)
                .map(LoopBehaviorConstraint.class::cast)
                .anyMatch(c -> c.getRequirement() == LoopRequirement.ACCUMULATE);
    }

    /**
     * The first NOT_ADJACENT pair made of two single characters, if any.
     */
    public Optional<List<String>> adjacencyPair() {
        return constraints.stream()
                .filter(PositionConstraint.class::isInstance)
                .map(PositionConstraint.class::cast)
                .filter(c -> c.getRequirement() == PositionRequirement.NOT_ADJACENT)
                .map(PositionConstraint::getElements)
                .filter(e -> e.size() == 2 && e.get(0).length() == 1 && e.get(1).length() == 1)
                .findFirst();
    }
}
