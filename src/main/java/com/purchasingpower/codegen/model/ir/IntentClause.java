package com.purchasingpower.codegen.model.ir;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder
@Jacksonized
public class IntentClause {
    String summary;
    String rationale;
    @Singular
    List<TypedHole> holes;
}
