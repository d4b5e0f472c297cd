package com.purchasingpower.codegen.service.repair.passes;

import com.purchasingpower.codegen.ast.java.JavaParsedSource;
import com.purchasingpower.codegen.ast.java.JavaSourceParser;
import com.purchasingpower.codegen.service.repair.RepairContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Boolean Comparison Pass Tests")
class BooleanComparisonPassTest {

    private final JavaSourceParser parser = new JavaSourceParser();
    private final BooleanComparisonPass pass = new BooleanComparisonPass();

    @Test
    @DisplayName("Should simplify comparisons against true and false")
    void testLiteralComparisons_ShouldBeSimplified() {
        // Given
        JavaParsedSource source = parser.parse("""
                boolean check(boolean ready, boolean done) {
                    if (ready == true) {
                        return done == false;
                    }
                    return false != ready;
                }
                """);

        // When
        List<String> fixes = pass.apply(source, "check", RepairContext.empty());

        // Then
        assertEquals(3, fixes.size());
        String printed = source.print();
        assertTrue(printed.contains("if (ready)"), printed);
        assertTrue(printed.contains("return !done;"), printed);
        assertTrue(printed.contains("return ready;"), printed);
        System.out.println("✅ " + fixes);
    }

    @Test
    @DisplayName("Should parenthesize compound operands when negating")
    void testCompoundOperand_ShouldBeParenthesized() {
        // Given
        JavaParsedSource source = parser.parse("""
                boolean outside(int x, int limit) {
                    return (x < limit) == false;
                }
                """);

        // When
        List<String> fixes = pass.apply(source, "outside", RepairContext.empty());

        // Then
        assertEquals(1, fixes.size());
        assertTrue(source.print().contains("return !(x < limit);"), source.print());
    }

    @Test
    @DisplayName("Should ignore comparisons of two literals or no literal")
    void testOtherComparisons_ShouldStay() {
        // Given
        JavaParsedSource source = parser.parse("""
                boolean same(boolean a, boolean b) {
                    return a == b;
                }
                """);

        // When / Then
        assertTrue(pass.apply(source, "same", RepairContext.empty()).isEmpty());
    }
}
