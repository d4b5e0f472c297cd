package com.purchasingpower.codegen.service.repair;

import lombok.Value;

import java.util.List;

/**
 * Repaired code plus a description of every fix applied. When nothing matched,
 * {@code code} is the input string unchanged and {@code appliedFixes} is empty.
 */
@Value
public class RepairResult {
    String code;
    List<String> appliedFixes;

    public static RepairResult unchanged(String code) {
        return new RepairResult(code, List.of());
    }

    public static RepairResult repaired(String code, List<String> appliedFixes) {
        return new RepairResult(code, List.copyOf(appliedFixes));
    }

    public boolean isChanged() {
        return !appliedFixes.isEmpty();
    }
}
