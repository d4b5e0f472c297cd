package com.purchasingpower.codegen.ast;

import lombok.Value;

/**
 * 1-based line and column span of a node in the candidate source as submitted.
 */
@Value
public class SourceRange {
    int beginLine;
    int beginColumn;
    int endLine;
    int endColumn;
}
