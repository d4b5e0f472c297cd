package com.purchasingpower.codegen.service.repair;

import com.purchasingpower.codegen.ast.ParsedSource;

import java.util.List;

/**
 * One deterministic AST-to-AST transformation fixing a single defect signature.
 *
 * <p>A pass rewrites only nodes that match its signature, in place, and reports what
 * it changed. Running a pass on its own output must report nothing.
 *
 * @param <S> parsed source type of the host-language adapter
 */
public interface RepairPass<S extends ParsedSource> {

    String getName();

    /**
     * @return descriptions of the fixes applied, empty when nothing matched
     */
    List<String> apply(S source, String functionName, RepairContext context);
}
