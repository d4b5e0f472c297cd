package com.purchasingpower.codegen.client;

/**
 * Source of candidate code: a prompt and a sampling temperature in, code out.
 *
 * @since 1.0.0
 */
public interface CodeGenerator {

    /**
     * @param prompt      fully rendered prompt
     * @param temperature sampling temperature for this attempt
     * @return candidate source code, without Markdown fences
     * @throws com.purchasingpower.codegen.exception.CodeGenerationException if no code could be produced
     */
    String generateCode(String prompt, double temperature);

    /**
     * Get the generator name (for logging).
     */
    String getName();
}
