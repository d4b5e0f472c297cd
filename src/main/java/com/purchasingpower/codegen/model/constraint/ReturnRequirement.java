package com.purchasingpower.codegen.model.constraint;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ReturnRequirement {
    MUST_RETURN,
    OPTIONAL_RETURN;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ReturnRequirement fromWireValue(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
