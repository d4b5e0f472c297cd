package com.purchasingpower.codegen.service.testing;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * One executable check of the target function: call it with {@code arguments} and
 * compare the result with {@code expected}. Arguments and expected value are Java
 * expressions, e.g. {@code new int[] {1, 2, 1}} or {@code "a@b.com"}.
 */
@Value
@Builder
public class TestCase {
    String name;
    @Singular
    List<String> arguments;
    String expected;
    String description;

    /**
     * Call expression as it would read in source, e.g. {@code findIndex(new int[] {1, 2}, 2)}.
     */
    public String describeCall(String functionName) {
        return functionName + "(" + String.join(", ", arguments) + ")";
    }
}
