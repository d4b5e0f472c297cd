package com.purchasingpower.codegen.exception;

/**
 * Raised when persisted constraint data cannot be mapped back to a constraint variant.
 */
public class ConstraintFormatException extends RuntimeException {

    public ConstraintFormatException(String message) {
        super(message);
    }

    public ConstraintFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
