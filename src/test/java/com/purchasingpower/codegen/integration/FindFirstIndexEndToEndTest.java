package com.purchasingpower.codegen.integration;

import com.purchasingpower.codegen.ast.java.JavaSourceParser;
import com.purchasingpower.codegen.configuration.TestingProperties;
import com.purchasingpower.codegen.model.constraint.Constraint;
import com.purchasingpower.codegen.model.constraint.ConstraintSeverity;
import com.purchasingpower.codegen.model.constraint.ConstraintViolation;
import com.purchasingpower.codegen.model.constraint.LoopBehaviorConstraint;
import com.purchasingpower.codegen.model.constraint.LoopRequirement;
import com.purchasingpower.codegen.model.constraint.LoopSearchType;
import com.purchasingpower.codegen.model.ir.AssertClause;
import com.purchasingpower.codegen.model.ir.EffectClause;
import com.purchasingpower.codegen.model.ir.IntentClause;
import com.purchasingpower.codegen.model.ir.IntermediateRepresentation;
import com.purchasingpower.codegen.model.ir.Parameter;
import com.purchasingpower.codegen.model.ir.SignatureClause;
import com.purchasingpower.codegen.service.detection.ConstraintDetector;
import com.purchasingpower.codegen.service.detection.ConstraintDetectorImpl;
import com.purchasingpower.codegen.service.detection.DetectionKeywords;
import com.purchasingpower.codegen.service.feedback.MessageFormatter;
import com.purchasingpower.codegen.service.feedback.MessageFormatterImpl;
import com.purchasingpower.codegen.service.repair.ASTRepairEngine;
import com.purchasingpower.codegen.service.repair.ASTRepairEngineImpl;
import com.purchasingpower.codegen.service.repair.RepairContext;
import com.purchasingpower.codegen.service.repair.RepairResult;
import com.purchasingpower.codegen.service.repair.passes.JavaRepairAdapter;
import com.purchasingpower.codegen.service.testing.AssertionTestCaseGenerator;
import com.purchasingpower.codegen.service.testing.InMemoryJavaCompiler;
import com.purchasingpower.codegen.service.testing.SandboxedJavaTestExecutor;
import com.purchasingpower.codegen.service.testing.TestCase;
import com.purchasingpower.codegen.service.testing.TestResult;
import com.purchasingpower.codegen.service.validation.ConstraintValidator;
import com.purchasingpower.codegen.service.validation.ConstraintValidatorImpl;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Walks the "find first index" scenario through every stage by hand: detect, validate
 * the buggy candidate, explain, repair, validate again and execute.
 */
@DisplayName("Find First Index End-to-End Tests")
class FindFirstIndexEndToEndTest {

    private static final String BUGGY_CANDIDATE = """
            int findIndex(int[] items, int target) {
                int result = -1;
                for (int i = 0; i < items.length; i++) {
                    if (items[i] == target) {
                        result = i;
                    }
                }
                return result;
            }
            """;

    private final JavaSourceParser parser = new JavaSourceParser();
    private final ConstraintDetector detector = new ConstraintDetectorImpl(DetectionKeywords.defaults());
    private final ConstraintValidator validator = new ConstraintValidatorImpl(parser);
    private final MessageFormatter formatter = new MessageFormatterImpl();
    private final ASTRepairEngine repairEngine = new ASTRepairEngineImpl(new JavaRepairAdapter(parser));
    private final SandboxedJavaTestExecutor executor =
            new SandboxedJavaTestExecutor(parser, new InMemoryJavaCompiler(), new TestingProperties());

    @Test
    @DisplayName("Buggy last-match loop should be detected, explained, repaired and then pass")
    void testFindFirstIndex_FullPipeline() {
        // ======================================================================
        // DETECT
        // ======================================================================
        IntermediateRepresentation ir = IntermediateRepresentation.builder()
                .intent(IntentClause.builder()
                        .summary("Find the first index of target in items")
                        .rationale("Callers stop at the earliest occurrence")
                        .build())
                .signature(SignatureClause.builder()
                        .name("findIndex")
                        .parameter(Parameter.of("items", "int[]"))
                        .parameter(Parameter.of("target", "int"))
                        .returns("int")
                        .build())
                .effect(EffectClause.of("Iterate over items and compare each element with target"))
                .assertion(AssertClause.of("findIndex(new int[] {1, 2, 1}, 1) == 0"))
                .assertion(AssertClause.of("findIndex(new int[] {3, 4}, 9) == -1"))
                .build();

        List<Constraint> constraints = detector.detectAndAttach(ir);

        LoopBehaviorConstraint loop = constraints.stream()
                .filter(LoopBehaviorConstraint.class::isInstance)
                .map(LoopBehaviorConstraint.class::cast)
                .findFirst()
                .orElseThrow(() -> new AssertionError("Loop constraint should be detected: " + constraints));
        assertEquals(LoopSearchType.FIRST_MATCH, loop.getSearchType());
        assertEquals(LoopRequirement.EARLY_RETURN, loop.getRequirement());
        System.out.println("✅ Detected: " + constraints);

        // ======================================================================
        // VALIDATE BUGGY CANDIDATE
        // ======================================================================
        List<ConstraintViolation> buggyViolations = validator.validate(BUGGY_CANDIDATE, ir);

        assertEquals(1, buggyViolations.size(), buggyViolations.toString());
        assertEquals(ConstraintSeverity.ERROR, buggyViolations.get(0).getSeverity());
        assertEquals("loop_constraint", buggyViolations.get(0).getKind());

        String feedback = formatter.formatViolationsSummary(buggyViolations, constraints);
        assertTrue(feedback.contains("Missing early return for FIRST match"));
        System.out.println("✅ Buggy candidate rejected: " + buggyViolations.get(0).toShortString());

        // ======================================================================
        // REPAIR AND RE-VALIDATE
        // ======================================================================
        RepairResult repaired = repairEngine.repair(BUGGY_CANDIDATE, "findIndex", RepairContext.of(constraints));

        assertTrue(repaired.isChanged());
        assertTrue(validator.validate(repaired.getCode(), ir).isEmpty(),
                "Repaired code should satisfy every constraint:\n" + repaired.getCode());

        // ======================================================================
        // EXECUTE
        // ======================================================================
        List<TestCase> tests = new AssertionTestCaseGenerator().generateTests(ir);
        List<TestResult> before = executor.executeAll(BUGGY_CANDIDATE, "findIndex", tests);
        List<TestResult> after = executor.executeAll(repaired.getCode(), "findIndex", tests);

        assertEquals(2, tests.size());
        assertFalse(before.get(0).isPassed(), "Buggy candidate returns the last match");
        assertTrue(after.stream().allMatch(TestResult::isPassed), after.toString());
        System.out.println("✅ Repaired candidate passes " + after.size() + " tests:\n" + repaired.getCode());
    }
}
