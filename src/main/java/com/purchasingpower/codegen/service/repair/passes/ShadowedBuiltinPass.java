package com.purchasingpower.codegen.service.repair.passes;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.FieldAccessExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.MethodReferenceExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.type.Type;
import com.purchasingpower.codegen.service.repair.RepairContext;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Pass 5. Renames locals and parameters that hide an implicitly imported
 * {@code java.lang} type. Every reference follows the rename, including a name used as
 * the scope of a call or field access, since a variable obscures a type of the same
 * name. Only when all declarations of the name are primitives does such a scope still
 * denote the type, and it is left alone.
 */
public class ShadowedBuiltinPass extends JavaRepairPass {

    static final Set<String> JAVA_LANG_TYPES = Set.of(
            "String", "Integer", "Long", "Double", "Float", "Short", "Byte", "Character", "Boolean",
            "Number", "Math", "Object", "System", "StringBuilder", "Thread", "Runtime", "Class",
            "Void", "Iterable", "Comparable", "Exception", "Error", "Enum", "Record");

    @Override
    protected List<String> repairMethod(MethodDeclaration method, RepairContext context) {
        Set<String> shadowed = new LinkedHashSet<>();
        method.findAll(Parameter.class).forEach(p -> collect(p.getNameAsString(), shadowed));
        method.findAll(VariableDeclarator.class).forEach(v -> collect(v.getNameAsString(), shadowed));

        List<String> fixes = new ArrayList<>();
        for (String name : shadowed) {
            Optional<String> replacement = freshName(method, name);
            if (replacement.isEmpty()) {
                continue;
            }
            rename(method, name, replacement.get(), !allPrimitive(method, name));
            fixes.add(String.format("Renamed '%s' shadowing java.lang.%s to '%s'", name, name, replacement.get()));
        }
        return fixes;
    }

    private void collect(String name, Set<String> shadowed) {
        if (JAVA_LANG_TYPES.contains(name)) {
            shadowed.add(name);
        }
    }

    private Optional<String> freshName(MethodDeclaration method, String name) {
        String lower = Character.toLowerCase(name.charAt(0)) + name.substring(1);
        if (!JavaRepairSupport.isNameTaken(method, lower)) {
            return Optional.of(lower);
        }
        String suffixed = lower + "Value";
        return JavaRepairSupport.isNameTaken(method, suffixed) ? Optional.empty() : Optional.of(suffixed);
    }

    private boolean allPrimitive(MethodDeclaration method, String name) {
        Stream<Type> parameterTypes = method.findAll(Parameter.class, p -> p.getNameAsString().equals(name))
                .stream().map(Parameter::getType);
        Stream<Type> variableTypes = method.findAll(VariableDeclarator.class, v -> v.getNameAsString().equals(name))
                .stream().map(VariableDeclarator::getType);
        return Stream.concat(parameterTypes, variableTypes).allMatch(Type::isPrimitiveType);
    }

    private void rename(MethodDeclaration method, String from, String to, boolean renameScopes) {
        method.findAll(Parameter.class, p -> p.getNameAsString().equals(from)).forEach(p -> p.setName(to));
        method.findAll(VariableDeclarator.class, v -> v.getNameAsString().equals(from)).forEach(v -> v.setName(to));
        method.findAll(NameExpr.class, n -> n.getNameAsString().equals(from) && (renameScopes || !isTypeScope(n)))
                .forEach(n -> n.setName(to));
    }

    private boolean isTypeScope(NameExpr name) {
        Optional<Node> parent = name.getParentNode();
        if (parent.isEmpty()) {
            return false;
        }
        Node node = parent.get();
        if (node instanceof MethodCallExpr call) {
            return call.getScope().filter(scope -> scope == name).isPresent();
        }
        if (node instanceof FieldAccessExpr access) {
            return access.getScope() == name;
        }
        if (node instanceof MethodReferenceExpr reference) {
            return reference.getScope() == name;
        }
        return false;
    }
}
