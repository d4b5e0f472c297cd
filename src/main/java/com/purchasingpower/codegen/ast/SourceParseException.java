package com.purchasingpower.codegen.ast;

import lombok.Getter;

/**
 * Candidate code could not be parsed. {@code lineNumber} is relative to the submitted
 * code and may be null when the parser reports no location.
 */
@Getter
public class SourceParseException extends RuntimeException {

    private final Integer lineNumber;

    public SourceParseException(String message, Integer lineNumber) {
        super(message);
        this.lineNumber = lineNumber;
    }
}
