package com.purchasingpower.codegen.service.repair.passes;

import com.github.javaparser.ast.body.MethodDeclaration;
import com.purchasingpower.codegen.ast.java.JavaParsedSource;
import com.purchasingpower.codegen.service.repair.RepairContext;
import com.purchasingpower.codegen.service.repair.RepairPass;

import java.util.ArrayList;
import java.util.List;

/**
 * Base for Java passes: applies {@link #repairMethod} to every method named after the
 * target function that has a body.
 */
public abstract class JavaRepairPass implements RepairPass<JavaParsedSource> {

    @Override
    public List<String> apply(JavaParsedSource source, String functionName, RepairContext context) {
        List<String> fixes = new ArrayList<>();
        for (MethodDeclaration method : source.findMethods(functionName)) {
            if (method.getBody().isPresent()) {
                fixes.addAll(repairMethod(method, context));
            }
        }
        return fixes;
    }

    @Override
    public String getName() {
        return getClass().getSimpleName();
    }

    protected abstract List<String> repairMethod(MethodDeclaration method, RepairContext context);
}
