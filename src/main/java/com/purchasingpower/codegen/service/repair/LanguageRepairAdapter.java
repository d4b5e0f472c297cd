package com.purchasingpower.codegen.service.repair;

import com.purchasingpower.codegen.ast.ParsedSource;

import java.util.List;

/**
 * Bundles the parser and the ordered repair passes for one host language.
 *
 * @param <S> parsed source type produced by the adapter's parser
 */
public interface LanguageRepairAdapter<S extends ParsedSource> {

    String getLanguage();

    /**
     * @throws com.purchasingpower.codegen.ast.SourceParseException if the code does not parse
     */
    S parse(String code);

    /**
     * Independent deep copy, used to roll back a pass that fails half way.
     */
    S copy(S source);

    /**
     * Passes in the order they must run.
     */
    List<RepairPass<S>> getPasses();
}
