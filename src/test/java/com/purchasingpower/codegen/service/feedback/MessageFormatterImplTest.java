package com.purchasingpower.codegen.service.feedback;

import com.purchasingpower.codegen.model.constraint.Constraint;
import com.purchasingpower.codegen.model.constraint.ConstraintSeverity;
import com.purchasingpower.codegen.model.constraint.ConstraintViolation;
import com.purchasingpower.codegen.model.constraint.LoopBehaviorConstraint;
import com.purchasingpower.codegen.model.constraint.LoopSearchType;
import com.purchasingpower.codegen.model.constraint.PositionConstraint;
import com.purchasingpower.codegen.model.constraint.PositionRequirement;
import com.purchasingpower.codegen.model.constraint.ReturnConstraint;
import com.purchasingpower.codegen.service.testing.TestCase;
import com.purchasingpower.codegen.service.testing.TestResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Message Formatter Tests")
class MessageFormatterImplTest {

    private final MessageFormatter formatter = new MessageFormatterImpl();

    private final LoopBehaviorConstraint firstMatch = LoopBehaviorConstraint.builder()
            .searchType(LoopSearchType.FIRST_MATCH)
            .build();

    @Test
    @DisplayName("Should explain a first-match violation with a fixed example")
    void testFormatViolation_FirstMatch() {
        // Given
        ConstraintViolation violation = ConstraintViolation.of(firstMatch,
                "FIRST_MATCH requires early return inside loop, but no return found in loop body", 3);

        // When
        String message = formatter.formatViolation(violation, firstMatch);

        // Then
        assertTrue(message.contains("Missing early return for FIRST match"));
        assertTrue(message.contains("How to fix:"));
        assertTrue(message.contains("return i;  // Early return on first match!"));
        System.out.println("✅ Formatted:\n" + message);
    }

    @Test
    @DisplayName("Should explain return, position and structural violations")
    void testFormatViolation_OtherKinds() {
        // Given
        ReturnConstraint returnConstraint = ReturnConstraint.builder().valueName("total").build();
        PositionConstraint position = PositionConstraint.builder().elements(List.of("@", ".")).minDistance(1).build();

        // When
        String missingReturn = formatter.formatViolation(ConstraintViolation.of(returnConstraint,
                "No return statement found. Expected to return 'total'", 1), returnConstraint);
        String adjacency = formatter.formatViolation(ConstraintViolation.of(position,
                "Constraint requires '@' and '.' to not be adjacent, but no position checking found", 1), position);
        String syntax = formatter.formatViolation(ConstraintViolation.syntaxError("Parse error", 4), null);
        String unmatched = formatter.formatViolation(ConstraintViolation.of(position, "odd", null), returnConstraint);

        // Then
        assertTrue(missingReturn.contains("Add 'return total;' after computing the value"), missingReturn);
        assertTrue(adjacency.contains("test@.com"));
        assertTrue(adjacency.contains("at least 2 characters apart"));
        assertTrue(syntax.startsWith("Syntax Error: Code cannot be parsed (line 4)"));
        assertEquals("Constraint violation: odd", unmatched);
    }

    @Test
    @DisplayName("Should separate blocking errors from advisory issues")
    void testFormatViolationsSummary() {
        // Given
        ReturnConstraint advisoryReturn = ReturnConstraint.builder().severity(ConstraintSeverity.WARNING).build();
        List<Constraint> constraints = List.of(firstMatch, advisoryReturn);
        List<ConstraintViolation> violations = List.of(
                ConstraintViolation.of(firstMatch, "no early return", 3),
                ConstraintViolation.of(advisoryReturn, "return looks odd", 5));

        // When
        String summary = formatter.formatViolationsSummary(violations, constraints);

        // Then
        assertTrue(summary.contains("CONSTRAINT VALIDATION FAILED"));
        assertTrue(summary.contains("Found 1 ERROR(s) - must fix before code can be accepted:"));
        assertTrue(summary.contains("ERROR 1/1:"));
        assertTrue(summary.contains("Found 1 advisory issue(s) - recommended to fix:"));
        assertTrue(summary.contains("WARNING 1/1: return looks odd"));
        assertEquals("All constraints satisfied ✓", formatter.formatViolationsSummary(List.of(), constraints));
    }

    @Test
    @DisplayName("Should explain each violation against the constraint that raised it")
    void testFormatViolationsSummary_TwoPositionConstraints() {
        // Given
        PositionConstraint adjacency = PositionConstraint.builder().elements(List.of("@", ".")).minDistance(1).build();
        PositionConstraint ordering = PositionConstraint.builder()
                .elements(List.of("(", ")"))
                .requirement(PositionRequirement.ORDERED)
                .build();
        List<ConstraintViolation> violations = List.of(
                ConstraintViolation.of(adjacency, "no position checking found", null),
                ConstraintViolation.of(ordering, "no ordering check found", null));

        // When
        String summary = formatter.formatViolationsSummary(violations, List.of(adjacency, ordering));

        // Then
        assertTrue(summary.contains("Elements must not be adjacent"), summary);
        assertTrue(summary.contains("Elements must appear in order"), summary);
        assertTrue(summary.contains("text.indexOf(\"(\")"), summary);
        System.out.println("✅ Summary:\n" + summary);
    }

    @Test
    @DisplayName("Should produce one-line hints per constraint")
    void testGetConstraintHint() {
        assertEquals("MUST use early return inside loop for FIRST match (not accumulate to last)",
                formatter.getConstraintHint(firstMatch));
        assertEquals("MUST explicitly return 'count' value (not null)",
                formatter.getConstraintHint(ReturnConstraint.builder().valueName("count").build()));
        assertEquals("MUST check '@' and '.' are NOT adjacent (distance > 1)",
                formatter.getConstraintHint(PositionConstraint.builder()
                        .elements(List.of("@", "."))
                        .minDistance(1)
                        .build()));
    }

    @Test
    @DisplayName("Should describe failed tests and stay silent when all pass")
    void testFormatTestFailures() {
        // Given
        TestCase firstOfTwo = TestCase.builder()
                .name("first of two")
                .argument("new int[] {1, 2, 1}")
                .argument("1")
                .expected("0")
                .build();
        TestResult wrong = TestResult.wrongOutput(firstOfTwo, "2", 3);
        TestResult timedOut = TestResult.timeout(firstOfTwo, 1000);

        // When
        String feedback = formatter.formatTestFailures("findIndex", List.of(wrong, timedOut));

        // Then
        assertTrue(feedback.startsWith("TEST EXECUTION FAILED: 2 of 2 test(s) failed"));
        assertTrue(feedback.contains("- findIndex(new int[] {1, 2, 1}, 1) returned 2, expected 0"));
        assertTrue(feedback.contains("did not finish: timed out after 1000ms"));
        assertTrue(feedback.contains("Check loop termination conditions"));
        assertEquals("", formatter.formatTestFailures("findIndex",
                List.of(TestResult.passed(firstOfTwo, "0", 1))));
    }
}
