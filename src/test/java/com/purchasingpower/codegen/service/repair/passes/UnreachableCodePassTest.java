package com.purchasingpower.codegen.service.repair.passes;

import com.purchasingpower.codegen.ast.java.JavaParsedSource;
import com.purchasingpower.codegen.ast.java.JavaSourceParser;
import com.purchasingpower.codegen.service.repair.RepairContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Unreachable Code Pass Tests")
class UnreachableCodePassTest {

    private final JavaSourceParser parser = new JavaSourceParser();
    private final UnreachableCodePass pass = new UnreachableCodePass();

    @Test
    @DisplayName("Should remove statements after return and throw")
    void testDeadStatements_ShouldBeRemoved() {
        // Given
        JavaParsedSource source = parser.parse("""
                int divide(int a, int b) {
                    if (b == 0) {
                        throw new IllegalArgumentException("b is zero");
                        System.out.println("never");
                    }
                    return a / b;
                    a++;
                    System.out.println(a);
                }
                """);

        // When
        List<String> fixes = pass.apply(source, "divide", RepairContext.empty());

        // Then
        assertTrue(fixes.contains("Removed 1 unreachable statement(s) after throw in divide()"), fixes.toString());
        assertTrue(fixes.contains("Removed 2 unreachable statement(s) after return in divide()"), fixes.toString());
        String printed = source.print();
        assertFalse(printed.contains("never"));
        assertFalse(printed.contains("a++"));
        assertTrue(printed.contains("return a / b;"));
        System.out.println("✅ " + fixes);
    }

    @Test
    @DisplayName("Should leave a method ending in return untouched")
    void testCleanMethod_ShouldStay() {
        // Given
        JavaParsedSource source = parser.parse("""
                int abs(int x) {
                    if (x < 0) {
                        return -x;
                    }
                    return x;
                }
                """);

        // When / Then
        assertTrue(pass.apply(source, "abs", RepairContext.empty()).isEmpty());
    }
}
