package com.purchasingpower.codegen.model.constraint;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum PositionRequirement {
    NOT_ADJACENT,
    ORDERED,
    MIN_DISTANCE,
    MAX_DISTANCE;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static PositionRequirement fromWireValue(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    /**
     * Whether satisfying this requirement needs a distance computation between positions.
     */
    public boolean isDistanceBased() {
        return this != ORDERED;
    }
}
