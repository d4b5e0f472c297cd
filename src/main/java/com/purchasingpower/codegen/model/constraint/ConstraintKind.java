package com.purchasingpower.codegen.model.constraint;

import java.util.Arrays;
import java.util.Optional;

/**
 * Discriminant of the constraint union, as written on the wire.
 */
public enum ConstraintKind {
    RETURN("return_constraint"),
    LOOP_BEHAVIOR("loop_constraint"),
    POSITION("position_constraint");

    public static final String RETURN_WIRE = "return_constraint";
    public static final String LOOP_WIRE = "loop_constraint";
    public static final String POSITION_WIRE = "position_constraint";

    private final String wireName;

    ConstraintKind(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    public static Optional<ConstraintKind> fromWireName(String wireName) {
        return Arrays.stream(values())
                .filter(kind -> kind.wireName.equals(wireName))
                .findFirst();
    }
}
