package com.purchasingpower.codegen.service.orchestration;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Value;

import java.util.Map;

/**
 * Final outcome of a generation run. {@code validated} is only ever true when the code
 * has no blocking violation and passed every test.
 */
@Value
public class GenerationResult {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @JsonProperty("source_code")
    String sourceCode;

    @JsonProperty("metadata")
    GenerationMetadata metadata;

    @JsonIgnore
    public boolean isValidated() {
        return metadata.isValidated();
    }

    /**
     * External shape: {@code {source_code, metadata: {validated, attempts_used, ...}}}.
     */
    public Map<String, Object> toMap() {
        return MAPPER.convertValue(this, new TypeReference<Map<String, Object>>() { });
    }
}
