package com.purchasingpower.codegen.model.constraint;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

/**
 * Requires a searching loop to either exit on the first match or keep going.
 *
 * <p>Typical defect: a "find first index" implementation that overwrites a sentinel on
 * every match and therefore returns the last one.
 */
@Value
public final class LoopBehaviorConstraint implements Constraint {

    @JsonProperty("search_type")
    LoopSearchType searchType;

    @JsonProperty("requirement")
    LoopRequirement requirement;

    @JsonProperty("loop_variable")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    String loopVariable;

    @JsonProperty("description")
    String description;

    @JsonProperty("severity")
    ConstraintSeverity severity;

    @Builder
    @JsonCreator
    public LoopBehaviorConstraint(@JsonProperty("search_type") LoopSearchType searchType,
                                  @JsonProperty("requirement") LoopRequirement requirement,
                                  @JsonProperty("loop_variable") String loopVariable,
                                  @JsonProperty("description") String description,
                                  @JsonProperty("severity") ConstraintSeverity severity) {
        this.searchType = searchType == null ? LoopSearchType.FIRST_MATCH : searchType;
        this.requirement = requirement == null ? LoopRequirement.forSearchType(this.searchType) : requirement;
        this.loopVariable = loopVariable == null || loopVariable.isBlank() ? null : loopVariable;
        this.description = description == null || description.isBlank()
                ? defaultDescription(this.searchType)
                : description;
        this.severity = severity == null ? ConstraintSeverity.ERROR : severity;
    }

    private static String defaultDescription(LoopSearchType searchType) {
        switch (searchType) {
            case FIRST_MATCH:
                return "Loop must return immediately on FIRST match (not continue to last)";
            case LAST_MATCH:
                return "Loop must return LAST match (accumulate until end)";
            default:
                return "Loop must return ALL matches";
        }
    }

    @Override
    public ConstraintKind getKind() {
        return ConstraintKind.LOOP_BEHAVIOR;
    }

    @Override
    public <R> R accept(ConstraintVisitor<R> visitor) {
        return visitor.visitLoopBehavior(this);
    }
}
