package com.purchasingpower.codegen.service.repair;

import com.purchasingpower.codegen.ast.ParsedSource;
import com.purchasingpower.codegen.ast.SourceParseException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs the host-language adapter's passes in order over one parsed tree.
 *
 * <p>Each pass sees the tree as rewritten by the passes before it. A pass that throws is
 * rolled back and skipped; the remaining passes still run. The tree is printed only when
 * at least one fix was applied, otherwise the original string is returned untouched.
 *
 * <p><b>Thread Safety:</b> Every call works on its own parsed tree; the engine itself
 * holds no mutable state.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ASTRepairEngineImpl implements ASTRepairEngine {

    private final LanguageRepairAdapter<?> adapter;

    @Override
    public RepairResult repair(String code, String functionName) {
        return repair(code, functionName, RepairContext.empty());
    }

    @Override
    public RepairResult repair(String code, String functionName, RepairContext context) {
        if (code == null || functionName == null) {
            return RepairResult.unchanged(code);
        }
        try {
            return run(adapter, code, functionName, context == null ? RepairContext.empty() : context);
        } catch (SourceParseException e) {
            log.debug("Skipping repair of '{}': {}", functionName, e.getMessage());
            return RepairResult.unchanged(code);
        } catch (RuntimeException e) {
            log.warn("Repair of '{}' failed, returning candidate unchanged", functionName, e);
            return RepairResult.unchanged(code);
        }
    }

    private <S extends ParsedSource> RepairResult run(LanguageRepairAdapter<S> languageAdapter, String code,
                                                      String functionName, RepairContext context) {
        S source = languageAdapter.parse(code);
        List<String> fixes = new ArrayList<>();

        for (RepairPass<S> pass : languageAdapter.getPasses()) {
            S snapshot = languageAdapter.copy(source);
            try {
                List<String> applied = pass.apply(source, functionName, context);
                if (!applied.isEmpty()) {
                    log.debug("🔧 {}: {}", pass.getName(), applied);
                    fixes.addAll(applied);
                }
            } catch (RuntimeException e) {
                log.warn("Repair pass {} failed on '{}', rolling it back", pass.getName(), functionName, e);
                source = snapshot;
            }
        }

        if (fixes.isEmpty()) {
            return RepairResult.unchanged(code);
        }
        log.info("🔧 Applied {} repair(s) to '{}'", fixes.size(), functionName);
        return RepairResult.repaired(source.print(), fixes);
    }
}
