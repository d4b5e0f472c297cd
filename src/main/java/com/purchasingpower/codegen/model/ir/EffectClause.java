package com.purchasingpower.codegen.model.ir;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder
@Jacksonized
public class EffectClause {
    String description;
    @Singular
    List<TypedHole> holes;

    public static EffectClause of(String description) {
        return EffectClause.builder().description(description).build();
    }
}
