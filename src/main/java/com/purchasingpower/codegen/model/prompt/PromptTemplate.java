package com.purchasingpower.codegen.model.prompt;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

/**
 * Prompt template loaded from YAML.
 *
 * YAML structure:
 * <pre>
 * name: constrained-code-gen
 * version: 1.0
 * language: java
 * systemPrompt: |
 *   You are an expert...
 * userPrompt: |
 *   Implement {{{signature}}}...
 * </pre>
 *
 * Placeholders use Mustache syntax; triple braces insert code without HTML escaping.
 *
 * @see com.purchasingpower.codegen.service.prompt.PromptLibraryService
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)  // Allow extra fields like "examples" for documentation
public class PromptTemplate {
    private String name;
    private String version;
    private String language;
    private String systemPrompt;
    private String userPrompt;
}
