package com.purchasingpower.codegen.service.orchestration;

/**
 * Stages a generation attempt moves through. An attempt ends in ACCEPTED, RETRY or
 * EXHAUSTED.
 */
public enum GenerationState {
    PROMPT_BUILD,
    EXTERNAL_GENERATE,
    AST_REPAIR,
    CONSTRAINT_VALIDATE,
    TEST_EXECUTE,
    ACCEPTED,
    RETRY,
    EXHAUSTED;

    public boolean isTerminal() {
        return this == ACCEPTED || this == EXHAUSTED;
    }
}
