package com.purchasingpower.codegen.model.ir;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Behavioral assertion. Predicates written as Java expressions of the form
 * {@code fn(args) == expected} double as executable test cases.
 */
@Value
@Builder
@Jacksonized
public class AssertClause {
    String predicate;
    String rationale;
    @Singular
    List<TypedHole> holes;

    public static AssertClause of(String predicate) {
        return AssertClause.builder().predicate(predicate).build();
    }
}
