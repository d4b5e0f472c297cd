package com.purchasingpower.codegen.ast.java;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.purchasingpower.codegen.ast.ParsedSource;
import com.purchasingpower.codegen.ast.SourceNode;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Parsed Java candidate. Candidates submitted as a bare method are held inside a
 * synthetic class and printed back without it.
 */
public final class JavaParsedSource implements ParsedSource {

    private final CompilationUnit compilationUnit;
    private final boolean wrapped;

    JavaParsedSource(CompilationUnit compilationUnit, boolean wrapped) {
        this.compilationUnit = compilationUnit;
        this.wrapped = wrapped;
    }

    public CompilationUnit getCompilationUnit() {
        return compilationUnit;
    }

    public boolean isWrapped() {
        return wrapped;
    }

    /**
     * Deep copy of the tree. Source ranges are not carried over.
     */
    public JavaParsedSource copy() {
        return new JavaParsedSource(compilationUnit.clone(), wrapped);
    }

    @Override
    public SourceNode getRoot() {
        return new JavaSourceNode(compilationUnit, wrapped ? JavaSourceParser.WRAPPER_LINES : 0);
    }

    /**
     * Every method declaration named {@code name}, overloads included.
     */
    public List<MethodDeclaration> findMethods(String name) {
        return compilationUnit.findAll(MethodDeclaration.class, m -> m.getNameAsString().equals(name));
    }

    @Override
    public String print() {
        if (!wrapped) {
            return compilationUnit.toString();
        }
        TypeDeclaration<?> holder = compilationUnit.getType(0);
        return holder.getMembers().stream()
                .map(Node::toString)
                .collect(Collectors.joining("\n\n")) + "\n";
    }
}
