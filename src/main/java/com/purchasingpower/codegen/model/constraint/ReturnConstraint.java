package com.purchasingpower.codegen.model.constraint;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

/**
 * Requires a computed value to be explicitly returned rather than dropped.
 *
 * <p>Guards against functions that compute {@code count} and then fall off the end.
 */
@Value
public final class ReturnConstraint implements Constraint {

    @JsonProperty("value_name")
    String valueName;

    @JsonProperty("requirement")
    ReturnRequirement requirement;

    @JsonProperty("description")
    String description;

    @JsonProperty("severity")
    ConstraintSeverity severity;

    @Builder
    @JsonCreator
    public ReturnConstraint(@JsonProperty("value_name") String valueName,
                            @JsonProperty("requirement") ReturnRequirement requirement,
                            @JsonProperty("description") String description,
                            @JsonProperty("severity") ConstraintSeverity severity) {
        this.valueName = valueName == null || valueName.isBlank() ? "result" : valueName;
        this.requirement = requirement == null ? ReturnRequirement.MUST_RETURN : requirement;
        this.description = description == null || description.isBlank()
                ? String.format("Function must return '%s' value explicitly", this.valueName)
                : description;
        this.severity = severity == null ? ConstraintSeverity.ERROR : severity;
    }

    @Override
    public ConstraintKind getKind() {
        return ConstraintKind.RETURN;
    }

    @Override
    public <R> R accept(ConstraintVisitor<R> visitor) {
        return visitor.visitReturn(this);
    }
}
