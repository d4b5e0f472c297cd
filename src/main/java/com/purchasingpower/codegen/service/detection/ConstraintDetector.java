package com.purchasingpower.codegen.service.detection;

import com.purchasingpower.codegen.model.constraint.Constraint;
import com.purchasingpower.codegen.model.ir.IntermediateRepresentation;

import java.util.List;

/**
 * Infers structural constraints from the natural-language parts of an IR.
 *
 * <p>Detection is deterministic and keyword based. It never throws: unmatched or
 * malformed input yields an empty list.
 *
 * @since 1.0.0
 */
public interface ConstraintDetector {

    /**
     * Detects constraints without modifying the IR.
     *
     * @return constraints in detection order: return, loop behavior, positions
     */
    List<Constraint> detect(IntermediateRepresentation ir);

    /**
     * Detects and attaches constraints to the IR unless it already carries them.
     *
     * @return the constraints attached to the IR after the call
     */
    List<Constraint> detectAndAttach(IntermediateRepresentation ir);
}
