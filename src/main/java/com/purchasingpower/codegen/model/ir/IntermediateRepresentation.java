package com.purchasingpower.codegen.model.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Preconditions;
import com.purchasingpower.codegen.model.constraint.Constraint;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Structured task description produced upstream of code generation: signature, intent,
 * effects, assertions and the constraints inferred from them.
 *
 * <p>Constraints are attached exactly once, by constraint detection, and are read-only
 * afterwards. A second {@link #attachConstraints(List)} call fails, which keeps retries
 * and best-of-N candidates validated against the same requirement set.
 *
 * <p><b>Thread Safety:</b> Not thread-safe until constraints are attached; after that
 * the instance is effectively immutable and may be shared by concurrent candidates.
 *
 * @since 1.0.0
 */
@Getter
@JsonIgnoreProperties(ignoreUnknown = true)
public class IntermediateRepresentation {

    private final IntentClause intent;
    private final SignatureClause signature;
    private final List<EffectClause> effects;
    private final List<AssertClause> assertions;
    private final IrMetadata metadata;
    private List<Constraint> constraints = List.of();
    private boolean constraintsAttached;

    @Builder
    @JsonCreator
    public IntermediateRepresentation(@JsonProperty("intent") IntentClause intent,
                                      @JsonProperty("signature") SignatureClause signature,
                                      @JsonProperty("effects") @Singular List<EffectClause> effects,
                                      @JsonProperty("assertions") @Singular List<AssertClause> assertions,
                                      @JsonProperty("metadata") IrMetadata metadata,
                                      @JsonProperty("constraints") List<Constraint> constraints) {
        this.intent = Preconditions.checkNotNull(intent, "Intent cannot be null");
        this.signature = Preconditions.checkNotNull(signature, "Signature cannot be null");
        this.effects = effects == null ? List.of() : List.copyOf(effects);
        this.assertions = assertions == null ? List.of() : List.copyOf(assertions);
        this.metadata = metadata == null ? IrMetadata.empty() : metadata;
        if (constraints != null && !constraints.isEmpty()) {
            attachConstraints(constraints);
        }
    }

    /**
     * Attaches the detected constraints. Allowed once per IR.
     *
     * @throws IllegalStateException if constraints were already attached
     */
    public synchronized void attachConstraints(List<? extends Constraint> detected) {
        Preconditions.checkNotNull(detected, "Constraints cannot be null");
        Preconditions.checkState(!constraintsAttached,
                "Constraints already attached to IR '%s'", signature.getName());
        this.constraints = Collections.unmodifiableList(new ArrayList<>(detected));
        this.constraintsAttached = true;
    }

    public synchronized List<Constraint> getConstraints() {
        return constraints;
    }

    @JsonIgnore
    public synchronized boolean isConstraintsAttached() {
        return constraintsAttached;
    }
}
