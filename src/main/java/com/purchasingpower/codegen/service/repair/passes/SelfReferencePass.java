package com.purchasingpower.codegen.service.repair.passes;

import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.FieldAccessExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.ThisExpr;
import com.purchasingpower.codegen.service.repair.RepairContext;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Pass 1. Removes {@code this.} from a static method and replaces a call that recurses
 * into the method with exactly its own parameters (which can never terminate) by the
 * {@link Math} function of the same name.
 */
public class SelfReferencePass extends JavaRepairPass {

    private static final Map<String, Integer> MATH_FUNCTIONS = Map.of(
            "max", 2,
            "min", 2,
            "abs", 1,
            "pow", 2,
            "sqrt", 1,
            "floor", 1,
            "ceil", 1,
            "round", 1,
            "signum", 1,
            "hypot", 2);

    @Override
    protected List<String> repairMethod(MethodDeclaration method, RepairContext context) {
        List<String> fixes = new ArrayList<>();
        if (method.isStatic()) {
            fixes.addAll(dropThis(method));
        }
        fixes.addAll(replaceSelfRecursion(method));
        return fixes;
    }

    private List<String> dropThis(MethodDeclaration method) {
        List<String> fixes = new ArrayList<>();
        for (MethodCallExpr call : JavaRepairSupport.ownNodes(method, MethodCallExpr.class)) {
            if (call.getScope().filter(Expression::isThisExpr).isPresent()) {
                call.removeScope();
                fixes.add(String.format("Removed 'this.' from call to %s() in static method %s()",
                        call.getNameAsString(), method.getNameAsString()));
            }
        }
        for (FieldAccessExpr access : JavaRepairSupport.ownNodes(method, FieldAccessExpr.class)) {
            if (access.getScope() instanceof ThisExpr) {
                String field = access.getNameAsString();
                access.replace(new NameExpr(field));
                fixes.add(String.format("Removed 'this.' from field '%s' in static method %s()",
                        field, method.getNameAsString()));
            }
        }
        return fixes;
    }

    private List<String> replaceSelfRecursion(MethodDeclaration method) {
        String name = method.getNameAsString();
        Integer arity = MATH_FUNCTIONS.get(name);
        if (arity == null || method.getParameters().size() != arity) {
            return List.of();
        }
        List<String> parameters = method.getParameters().stream().map(Parameter::getNameAsString).toList();

        List<String> fixes = new ArrayList<>();
        for (MethodCallExpr call : JavaRepairSupport.ownNodes(method, MethodCallExpr.class)) {
            boolean unqualified = call.getScope().map(Expression::isThisExpr).orElse(true);
            if (!unqualified || !call.getNameAsString().equals(name) || !hasArguments(call, parameters)) {
                continue;
            }
            String before = call.toString();
            call.setScope(new NameExpr("Math"));
            fixes.add(String.format("Replaced self-recursive call %s with %s", before, call));
        }
        return fixes;
    }

    private boolean hasArguments(MethodCallExpr call, List<String> parameters) {
        if (call.getArguments().size() != parameters.size()) {
            return false;
        }
        for (int i = 0; i < parameters.size(); i++) {
            Expression argument = call.getArgument(i);
            if (!(argument instanceof NameExpr nameExpr) || !nameExpr.getNameAsString().equals(parameters.get(i))) {
                return false;
            }
        }
        return true;
    }
}
