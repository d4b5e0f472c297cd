package com.purchasingpower.codegen.service.orchestration;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class GenerationMetadata {

    @JsonProperty("validated")
    boolean validated;

    @JsonProperty("attempts_used")
    int attemptsUsed;

    @JsonProperty("tests_passed")
    int testsPassed;

    @JsonProperty("tests_total")
    int testsTotal;

    @Builder.Default
    @JsonProperty("applied_repairs")
    List<String> appliedRepairs = List.of();

    @Builder.Default
    @JsonProperty("warnings")
    List<String> warnings = List.of();

    /**
     * Attempt that produced the returned code, {@code null} when no code was produced.
     */
    @JsonProperty("best_attempt")
    Integer bestAttempt;

    @JsonProperty("candidates_evaluated")
    int candidatesEvaluated;
}
