package com.purchasingpower.codegen.service.feedback;

import com.purchasingpower.codegen.model.constraint.Constraint;
import com.purchasingpower.codegen.model.constraint.ConstraintViolation;
import com.purchasingpower.codegen.service.testing.TestResult;

import java.util.List;

/**
 * Turns violations into corrective feedback for the next generation prompt, and
 * constraints into short hints for every prompt.
 *
 * @since 1.0.0
 */
public interface MessageFormatter {

    /**
     * Explains one violation: what is wrong, why it matters, how to fix it, with a
     * before/after example.
     *
     * @param constraint the violated constraint, or {@code null} when unknown
     */
    String formatViolation(ConstraintViolation violation, Constraint constraint);

    /**
     * Report separating blocking ERROR violations from advisory ones.
     */
    String formatViolationsSummary(List<ConstraintViolation> violations, List<Constraint> constraints);

    /**
     * One-line hint injected proactively into generation prompts.
     */
    String getConstraintHint(Constraint constraint);

    /**
     * Feedback for failed test executions. Empty string when every test passed.
     */
    String formatTestFailures(String functionName, List<TestResult> results);
}
