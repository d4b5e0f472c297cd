package com.purchasingpower.codegen.service.detection;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Immutable keyword tables driving constraint detection.
 *
 * <p>Built once (from defaults or {@code app.detection.*}) and handed to the detector, so
 * tests can run the detector against a custom vocabulary without touching shared state.
 * All entries are matched as lower-case substrings.
 *
 * @since 1.0.0
 */
@Value
@Builder(toBuilder = true)
public class DetectionKeywords {

    @Builder.Default
    List<String> computationKeywords = List.of(
            "return", "returns", "compute", "computes", "calculate", "calculates",
            "count", "counts", "sum", "sums", "result", "output");

    /** Preferred return value names, in priority order. */
    @Builder.Default
    List<String> valueNames = List.of(
            "count", "index", "sum", "total", "result", "value", "output", "answer");

    @Builder.Default
    List<String> loopKeywords = List.of(
            "loop", "iterate", "iteration", "for each", "traverse", "walk through");

    @Builder.Default
    List<String> firstMatchKeywords = List.of(
            "first", "earliest", "initial", "find first", "locate first", "search for first");

    @Builder.Default
    List<String> lastMatchKeywords = List.of(
            "last", "final", "find last", "locate last", "search for last");

    @Builder.Default
    List<String> allMatchesKeywords = List.of(
            "all", "every", "each", "collect all", "find all", "gather all");

    @Builder.Default
    List<String> positionKeywords = List.of(
            "adjacent", "next to", "immediately after", "immediately before", "distance",
            "position", "placement", "between", "not adjacent", "separated");

    @Builder.Default
    List<String> emailKeywords = List.of("email", "e-mail", "@");

    @Builder.Default
    List<String> bracketKeywords = List.of("parenthes", "bracket", "brace", "balanced");

    /** Regexes whose first group names the loop variable. */
    @Builder.Default
    List<String> loopVariablePatterns = List.of(
            "for each (\\w+)", "iterate over (\\w+)", "loop through (\\w+)", "for every (\\w+)");

    public static DetectionKeywords defaults() {
        return DetectionKeywords.builder().build();
    }
}
