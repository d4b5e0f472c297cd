package com.purchasingpower.codegen.configuration;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@ConfigurationProperties(prefix = "app.llm")
public class LlmProperties {

    @NotBlank
    private String baseUrl = "http://localhost:11434";

    @NotBlank
    private String modelName = "qwen2.5-coder:7b";

    @Min(1)
    private int timeoutSeconds = 120;

    @Min(0)
    private int maxRetries = 2;

    private boolean logRequests = false;

    private boolean logResponses = false;
}
