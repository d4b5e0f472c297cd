package com.purchasingpower.codegen.service.orchestration;

import com.purchasingpower.codegen.model.constraint.ConstraintViolation;
import com.purchasingpower.codegen.service.testing.TestResult;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * One evaluated candidate: what the generator returned, what the repair engine made of
 * it, and how it fared against constraints and tests.
 */
@Value
@Builder
public class GenerationAttempt {

    int attemptNumber;

    /**
     * Position within the attempt when several candidates are sampled (0-based).
     */
    int candidateIndex;

    double temperature;

    String rawCode;

    /**
     * Repaired code, or {@code null} when the generator failed.
     */
    String code;

    @Builder.Default
    List<String> appliedRepairs = List.of();

    @Builder.Default
    List<ConstraintViolation> violations = List.of();

    @Builder.Default
    List<TestResult> testResults = List.of();

    /**
     * Why the generator produced nothing, {@code null} when it did.
     */
    String generationError;

    public static GenerationAttempt failed(int attemptNumber, int candidateIndex, double temperature, String error) {
        return GenerationAttempt.builder()
                .attemptNumber(attemptNumber)
                .candidateIndex(candidateIndex)
                .temperature(temperature)
                .generationError(error)
                .build();
    }

    public boolean hasCode() {
        return code != null;
    }

    /**
     * Blocking violations; a candidate without code ranks behind every candidate with code.
     */
    public int getErrorCount() {
        if (!hasCode()) {
            return Integer.MAX_VALUE;
        }
        return (int) violations.stream().filter(ConstraintViolation::isBlocking).count();
    }

    public int getTestsPassed() {
        return (int) testResults.stream().filter(TestResult::isPassed).count();
    }

    public int getTestsTotal() {
        return testResults.size();
    }

    public boolean isAccepted() {
        return hasCode() && getErrorCount() == 0 && getTestsPassed() == getTestsTotal();
    }

    public String label() {
        return "attempt " + attemptNumber + "/candidate " + candidateIndex;
    }
}
