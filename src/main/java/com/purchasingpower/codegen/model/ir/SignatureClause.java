package com.purchasingpower.codegen.model.ir;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Target function signature. {@code returns} holds a Java type name; {@code null},
 * blank or {@code void} means the function produces no value.
 */
@Value
@Builder
@Jacksonized
public class SignatureClause {
    String name;
    @Singular
    List<Parameter> parameters;
    String returns;
    @Singular
    List<TypedHole> holes;

    public boolean returnsValue() {
        return returns != null && !returns.isBlank() && !"void".equals(returns.trim())
                && !"None".equals(returns.trim());
    }

    /**
     * Renders a Java method header, e.g. {@code int findIndex(int[] items, int target)}.
     */
    public String toJavaSignature() {
        String params = parameters.stream()
                .map(p -> p.getTypeHint() + " " + p.getName())
                .collect(Collectors.joining(", "));
        return String.format("%s %s(%s)", returnsValue() ? returns.trim() : "void", name, params);
    }
}
