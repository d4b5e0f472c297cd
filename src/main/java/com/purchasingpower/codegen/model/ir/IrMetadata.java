package com.purchasingpower.codegen.model.ir;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class IrMetadata {
    String sourcePath;
    @Builder.Default
    String language = "java";
    String origin;

    public static IrMetadata empty() {
        return IrMetadata.builder().build();
    }
}
