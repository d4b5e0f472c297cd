package com.purchasingpower.codegen.ast;

/**
 * Parser/unparser adapter for one host language.
 */
public interface SourceParser {

    String getLanguage();

    /**
     * Parses a candidate.
     *
     * @throws SourceParseException if the code is not syntactically valid
     */
    ParsedSource parse(String code);
}
