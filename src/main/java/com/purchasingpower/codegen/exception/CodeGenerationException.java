package com.purchasingpower.codegen.exception;

import lombok.Getter;

/**
 * The external code generator could not produce a candidate.
 */
@Getter
public class CodeGenerationException extends RuntimeException {

    private final double temperature;

    public CodeGenerationException(String message, double temperature, Throwable cause) {
        super(message, cause);
        this.temperature = temperature;
    }
}
