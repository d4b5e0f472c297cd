package com.purchasingpower.codegen.model.constraint;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Which matches a searching loop is expected to produce.
 */
public enum LoopSearchType {
    FIRST_MATCH,
    LAST_MATCH,
    ALL_MATCHES;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static LoopSearchType fromWireValue(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
