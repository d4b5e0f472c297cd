package com.purchasingpower.codegen.service.repair.passes;

import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.Statement;
import com.purchasingpower.codegen.service.repair.RepairContext;

import java.util.ArrayList;
import java.util.List;

/**
 * Pass 4. Deletes statements that follow an unconditional {@code return} or
 * {@code throw} in the same block.
 */
public class UnreachableCodePass extends JavaRepairPass {

    @Override
    protected List<String> repairMethod(MethodDeclaration method, RepairContext context) {
        List<String> fixes = new ArrayList<>();
        for (BlockStmt block : method.findAll(BlockStmt.class)) {
            if (!method.isAncestorOf(block)) {
                continue;
            }
            NodeList<Statement> statements = block.getStatements();
            int exit = firstExit(statements);
            if (exit < 0 || exit == statements.size() - 1) {
                continue;
            }
            List<Statement> dead = new ArrayList<>(statements.subList(exit + 1, statements.size()));
            dead.forEach(Statement::remove);
            fixes.add(String.format("Removed %d unreachable statement(s) after %s in %s()",
                    dead.size(), statements.get(exit).isReturnStmt() ? "return" : "throw", method.getNameAsString()));
        }
        return fixes;
    }

    private int firstExit(NodeList<Statement> statements) {
        for (int i = 0; i < statements.size(); i++) {
            Statement statement = statements.get(i);
            if (statement.isReturnStmt() || statement.isThrowStmt()) {
                return i;
            }
        }
        return -1;
    }
}
