package com.purchasingpower.codegen.service.repair.passes;

import com.purchasingpower.codegen.ast.java.JavaParsedSource;
import com.purchasingpower.codegen.ast.java.JavaSourceParser;
import com.purchasingpower.codegen.service.repair.LanguageRepairAdapter;
import com.purchasingpower.codegen.service.repair.RepairPass;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Java parser plus the eight Java repair passes, in the order they must run.
 */
@Component
@RequiredArgsConstructor
public class JavaRepairAdapter implements LanguageRepairAdapter<JavaParsedSource> {

    private static final List<RepairPass<JavaParsedSource>> PASSES = List.of(
            new SelfReferencePass(),
            new UnusedLoopVariablePass(),
            new BooleanComparisonPass(),
            new UnreachableCodePass(),
            new ShadowedBuiltinPass(),
            new AdjacencyCheckPass(),
            new MissingReturnPass(),
            new LoopEarlyReturnPass());

    private final JavaSourceParser parser;

    @Override
    public String getLanguage() {
        return parser.getLanguage();
    }

    @Override
    public JavaParsedSource parse(String code) {
        return parser.parse(code);
    }

    @Override
    public JavaParsedSource copy(JavaParsedSource source) {
        return source.copy();
    }

    @Override
    public List<RepairPass<JavaParsedSource>> getPasses() {
        return PASSES;
    }
}
