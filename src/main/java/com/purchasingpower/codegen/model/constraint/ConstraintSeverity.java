package com.purchasingpower.codegen.model.constraint;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Severity of a constraint. Only {@link #ERROR} blocks acceptance of a candidate.
 */
public enum ConstraintSeverity {
    ERROR,
    WARNING,
    INFO,
    HINT;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ConstraintSeverity fromWireValue(String value) {
        if (value == null) {
            return ERROR;
        }
        return ConstraintSeverity.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    public boolean isBlocking() {
        return this == ERROR;
    }
}
