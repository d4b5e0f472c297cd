package com.purchasingpower.codegen.service.orchestration;

import com.purchasingpower.codegen.model.ir.IntermediateRepresentation;

/**
 * Drives generate, repair, validate and test until a candidate is accepted or the
 * attempts run out.
 *
 * @since 1.0.0
 */
public interface GenerationOrchestrator {

    /**
     * Uses the configured {@code app.generation.max-attempts}.
     */
    GenerationResult generate(IntermediateRepresentation ir);

    /**
     * @throws IllegalArgumentException if {@code maxAttempts < 1}
     */
    GenerationResult generate(IntermediateRepresentation ir, int maxAttempts);
}
