package com.purchasingpower.codegen.model.constraint;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Relative-position requirement between two or more textual elements, e.g. {@code '@'}
 * and {@code '.'} in an email address.
 */
@Value
public final class PositionConstraint implements Constraint {

    @JsonProperty("elements")
    List<String> elements;

    @JsonProperty("requirement")
    PositionRequirement requirement;

    @JsonProperty("min_distance")
    int minDistance;

    @JsonProperty("max_distance")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    Integer maxDistance;

    @JsonProperty("description")
    String description;

    @JsonProperty("severity")
    ConstraintSeverity severity;

    @Builder
    @JsonCreator
    public PositionConstraint(@JsonProperty("elements") List<String> elements,
                              @JsonProperty("requirement") PositionRequirement requirement,
                              @JsonProperty("min_distance") int minDistance,
                              @JsonProperty("max_distance") Integer maxDistance,
                              @JsonProperty("description") String description,
                              @JsonProperty("severity") ConstraintSeverity severity) {
        this.elements = elements == null ? List.of() : List.copyOf(elements);
        this.requirement = requirement == null ? PositionRequirement.NOT_ADJACENT : requirement;
        this.minDistance = minDistance;
        this.maxDistance = maxDistance;
        this.description = description == null || description.isBlank()
                ? defaultDescription(this.elements, this.requirement, minDistance, maxDistance)
                : description;
        this.severity = severity == null ? ConstraintSeverity.ERROR : severity;
    }

    private static String defaultDescription(List<String> elements, PositionRequirement requirement,
                                             int minDistance, Integer maxDistance) {
        switch (requirement) {
            case ORDERED:
                return String.format("Elements %s must appear in this order", elements);
            case MIN_DISTANCE:
                return String.format("Elements %s must be at least %d characters apart", elements, minDistance);
            case MAX_DISTANCE:
                return String.format("Elements %s must be at most %s characters apart", elements, maxDistance);
            default:
                return String.format("Elements %s must NOT be immediately adjacent", elements);
        }
    }

    /**
     * Elements joined for messages: {@code '@' and '.'}.
     */
    public String describeElements(String separator) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < elements.size(); i++) {
            if (i > 0) {
                sb.append(separator);
            }
            sb.append('\'').append(elements.get(i)).append('\'');
        }
        return sb.toString();
    }

    @Override
    public ConstraintKind getKind() {
        return ConstraintKind.POSITION;
    }

    @Override
    public <R> R accept(ConstraintVisitor<R> visitor) {
        return visitor.visitPosition(this);
    }
}
