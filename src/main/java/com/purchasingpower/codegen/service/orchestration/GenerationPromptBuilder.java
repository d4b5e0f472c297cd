package com.purchasingpower.codegen.service.orchestration;

import com.google.common.base.Strings;
import com.purchasingpower.codegen.model.constraint.Constraint;
import com.purchasingpower.codegen.model.ir.AssertClause;
import com.purchasingpower.codegen.model.ir.EffectClause;
import com.purchasingpower.codegen.model.ir.IntermediateRepresentation;
import com.purchasingpower.codegen.service.feedback.MessageFormatter;
import com.purchasingpower.codegen.service.prompt.PromptLibraryService;
import com.purchasingpower.codegen.service.testing.TestResult;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Renders the generation prompt for one attempt.
 *
 * <p>Every attempt carries the constraint hints. From the second attempt on, the prompt
 * also carries the previous attempt's best candidate together with its violation summary
 * and failing-test feedback.
 */
@Component
@RequiredArgsConstructor
public class GenerationPromptBuilder {

    static final String TEMPLATE = "constrained-code-gen";

    private final PromptLibraryService promptLibrary;
    private final MessageFormatter formatter;

    public String build(IntermediateRepresentation ir, List<Constraint> constraints, GenerationAttempt previous) {
        Map<String, Object> context = new HashMap<>();
        context.put("signature", ir.getSignature().toJavaSignature());
        context.put("summary", ir.getIntent() != null && !Strings.isNullOrEmpty(ir.getIntent().getSummary())
                ? ir.getIntent().getSummary()
                : ir.getSignature().getName());
        if (ir.getIntent() != null && !Strings.isNullOrEmpty(ir.getIntent().getRationale())) {
            context.put("rationale", ir.getIntent().getRationale());
        }

        putList(context, "effects", "hasEffects", ir.getEffects().stream()
                .map(EffectClause::getDescription)
                .filter(Objects::nonNull)
                .collect(Collectors.toList()));
        putList(context, "assertions", "hasAssertions", ir.getAssertions().stream()
                .map(AssertClause::getPredicate)
                .filter(Objects::nonNull)
                .collect(Collectors.toList()));
        putList(context, "hints", "hasHints", constraints.stream()
                .map(formatter::getConstraintHint)
                .collect(Collectors.toList()));

        // On retries, include feedback on the previous attempt's best candidate
        if (previous != null) {
            context.put("previousAttempt", previous.getAttemptNumber());
            context.put("feedback", feedback(ir.getSignature().getName(), constraints, previous));
            if (previous.hasCode()) {
                context.put("previousCode", previous.getCode().strip());
            }
        }

        return promptLibrary.render(TEMPLATE, context);
    }

    private String feedback(String functionName, List<Constraint> constraints, GenerationAttempt previous) {
        if (!previous.hasCode()) {
            return "No code was produced: " + previous.getGenerationError();
        }
        List<String> sections = new ArrayList<>();
        if (!previous.getViolations().isEmpty()) {
            sections.add(formatter.formatViolationsSummary(previous.getViolations(), constraints));
        }
        List<TestResult> failed = previous.getTestResults().stream()
                .filter(result -> !result.isPassed())
                .collect(Collectors.toList());
        if (!failed.isEmpty()) {
            sections.add(formatter.formatTestFailures(functionName, failed));
        }
        return String.join("\n\n", sections);
    }

    private void putList(Map<String, Object> context, String key, String flag, List<String> values) {
        context.put(key, values);
        context.put(flag, !values.isEmpty());
    }
}
