package com.purchasingpower.codegen.service.orchestration;

import java.util.Comparator;
import java.util.List;

/**
 * One key of the ordering used to pick the best candidate. Criteria are applied in the
 * configured order; the candidate index always breaks the final tie.
 */
public enum SelectionCriterion {

    FEWEST_ERRORS(Comparator.comparingInt(GenerationAttempt::getErrorCount)),
    MOST_TESTS_PASSED(Comparator.comparingInt(GenerationAttempt::getTestsPassed).reversed()),
    EARLIEST_ATTEMPT(Comparator.comparingInt(GenerationAttempt::getAttemptNumber));

    public static final List<SelectionCriterion> DEFAULT_ORDER =
            List.of(FEWEST_ERRORS, MOST_TESTS_PASSED, EARLIEST_ATTEMPT);

    private final Comparator<GenerationAttempt> comparator;

    SelectionCriterion(Comparator<GenerationAttempt> comparator) {
        this.comparator = comparator;
    }

    /**
     * Combined ordering, best candidate first.
     */
    public static Comparator<GenerationAttempt> ordering(List<SelectionCriterion> order) {
        List<SelectionCriterion> criteria = order == null || order.isEmpty() ? DEFAULT_ORDER : order;
        Comparator<GenerationAttempt> combined = criteria.get(0).comparator;
        for (SelectionCriterion criterion : criteria.subList(1, criteria.size())) {
            combined = combined.thenComparing(criterion.comparator);
        }
        return combined.thenComparingInt(GenerationAttempt::getCandidateIndex);
    }
}
