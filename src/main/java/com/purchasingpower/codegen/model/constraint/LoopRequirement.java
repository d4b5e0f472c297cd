package com.purchasingpower.codegen.model.constraint;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Required exit behavior of a searching loop.
 */
public enum LoopRequirement {
    /** Return as soon as a match is found. */
    EARLY_RETURN,
    /** Keep iterating and collect or overwrite, return after the loop. */
    ACCUMULATE;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static LoopRequirement fromWireValue(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    public static LoopRequirement forSearchType(LoopSearchType searchType) {
        return searchType == LoopSearchType.FIRST_MATCH ? EARLY_RETURN : ACCUMULATE;
    }
}
