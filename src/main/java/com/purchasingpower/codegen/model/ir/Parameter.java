package com.purchasingpower.codegen.model.ir;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class Parameter {
    String name;
    String typeHint;
    String description;

    public static Parameter of(String name, String typeHint) {
        return Parameter.builder().name(name).typeHint(typeHint).build();
    }
}
