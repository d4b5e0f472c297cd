package com.purchasingpower.codegen.model.constraint;

import lombok.Builder;
import lombok.Value;

/**
 * A detected failure of a candidate to satisfy a constraint.
 *
 * <p>{@code kind} is {@value #SYNTAX_ERROR}, {@value #MISSING_FUNCTION}, or the wire name
 * of the violated constraint. Violations are produced by the validator only and are never
 * persisted.
 *
 * @since 1.0.0
 */
@Value
@Builder
public class ConstraintViolation {

    public static final String SYNTAX_ERROR = "syntax_error";
    public static final String MISSING_FUNCTION = "missing_function";

    String kind;
    String message;
    @Builder.Default
    ConstraintSeverity severity = ConstraintSeverity.ERROR;
    Integer lineNumber;     // null when the checker cannot point at a line
    Constraint constraint;  // null for syntax and missing-function violations

    public boolean isBlocking() {
        return severity.isBlocking();
    }

    public static ConstraintViolation syntaxError(String message, Integer lineNumber) {
        return ConstraintViolation.builder()
                .kind(SYNTAX_ERROR)
                .message(message)
                .lineNumber(lineNumber)
                .build();
    }

    public static ConstraintViolation missingFunction(String functionName) {
        return ConstraintViolation.builder()
                .kind(MISSING_FUNCTION)
                .message(String.format("Function '%s' not found in generated code", functionName))
                .build();
    }

    public static ConstraintViolation of(Constraint constraint, String message, Integer lineNumber) {
        return ConstraintViolation.builder()
                .kind(constraint.getKind().getWireName())
                .message(message)
                .severity(constraint.getSeverity())
                .lineNumber(lineNumber)
                .constraint(constraint)
                .build();
    }

    /**
     * One-line form used in warnings and logs.
     */
    public String toShortString() {
        String location = lineNumber == null ? "" : " (line " + lineNumber + ")";
        return String.format("%s [%s]%s: %s", kind, severity.wireValue(), location, message);
    }
}
