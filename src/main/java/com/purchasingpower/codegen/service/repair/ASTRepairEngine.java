package com.purchasingpower.codegen.service.repair;

/**
 * Applies the ordered repair passes to a candidate.
 *
 * <p>Pure and total: on a parse failure the input comes back unchanged with no fixes,
 * and repairing already-repaired code reports no fixes.
 *
 * @since 1.0.0
 */
public interface ASTRepairEngine {

    RepairResult repair(String code, String functionName);

    RepairResult repair(String code, String functionName, RepairContext context);
}
