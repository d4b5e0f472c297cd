package com.purchasingpower.codegen.model.constraint;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * A structural correctness requirement inferred from a natural-language task description
 * and checked against generated code.
 *
 * <p>The set of implementations is sealed to {@link ReturnConstraint},
 * {@link LoopBehaviorConstraint} and {@link PositionConstraint}. Code that needs to act
 * on the concrete variant goes through {@link #accept(ConstraintVisitor)}.
 *
 * <p>Serialized form is a tagged object keyed by {@code kind}, see {@link ConstraintCodec}.
 *
 * <p><b>Thread Safety:</b> All implementations are immutable.
 *
 * @since 1.0.0
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ReturnConstraint.class, name = ConstraintKind.RETURN_WIRE),
        @JsonSubTypes.Type(value = LoopBehaviorConstraint.class, name = ConstraintKind.LOOP_WIRE),
        @JsonSubTypes.Type(value = PositionConstraint.class, name = ConstraintKind.POSITION_WIRE)
})
public sealed interface Constraint
        permits ReturnConstraint, LoopBehaviorConstraint, PositionConstraint {

    @JsonIgnore
    ConstraintKind getKind();

    String getDescription();

    ConstraintSeverity getSeverity();

    <R> R accept(ConstraintVisitor<R> visitor);
}
