package com.purchasingpower.codegen.service.repair.passes;

import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.stmt.ForEachStmt;
import com.purchasingpower.codegen.service.repair.RepairContext;

import java.util.ArrayList;
import java.util.List;

/**
 * Pass 2. Renames an enhanced-for variable that the loop body never reads to
 * {@value #UNUSED_NAME}.
 */
public class UnusedLoopVariablePass extends JavaRepairPass {

    static final String UNUSED_NAME = "ignored";

    @Override
    protected List<String> repairMethod(MethodDeclaration method, RepairContext context) {
        List<String> fixes = new ArrayList<>();
        for (ForEachStmt loop : method.findAll(ForEachStmt.class)) {
            VariableDeclarator variable = loop.getVariableDeclarator();
            String name = variable.getNameAsString();
            if (name.equals(UNUSED_NAME) || isRead(loop, name) || JavaRepairSupport.isNameTaken(method, UNUSED_NAME)) {
                continue;
            }
            variable.setName(UNUSED_NAME);
            fixes.add(String.format("Renamed unused loop variable '%s' to '%s'", name, UNUSED_NAME));
        }
        return fixes;
    }

    private boolean isRead(ForEachStmt loop, String name) {
        return !loop.getBody().findAll(NameExpr.class, n -> n.getNameAsString().equals(name)).isEmpty();
    }
}
