package com.purchasingpower.codegen.service.validation;

import com.purchasingpower.codegen.model.constraint.ConstraintViolation;
import com.purchasingpower.codegen.model.ir.IntermediateRepresentation;

import java.util.List;

/**
 * Checks candidate code against the constraints attached to an IR.
 *
 * <p>Implementations never throw on bad input: unparsable code yields exactly one
 * {@code syntax_error} violation, a missing target function exactly one
 * {@code missing_function} violation.
 *
 * @since 1.0.0
 */
public interface ConstraintValidator {

    List<ConstraintViolation> validate(String code, IntermediateRepresentation ir);

    /**
     * A candidate is acceptable to validation when no ERROR-severity violation remains.
     */
    default boolean isAcceptable(List<ConstraintViolation> violations) {
        return violations.stream().noneMatch(ConstraintViolation::isBlocking);
    }
}
