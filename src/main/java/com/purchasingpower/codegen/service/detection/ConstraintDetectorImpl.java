package com.purchasingpower.codegen.service.detection;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.purchasingpower.codegen.model.constraint.Constraint;
import com.purchasingpower.codegen.model.constraint.LoopBehaviorConstraint;
import com.purchasingpower.codegen.model.constraint.LoopRequirement;
import com.purchasingpower.codegen.model.constraint.LoopSearchType;
import com.purchasingpower.codegen.model.constraint.PositionConstraint;
import com.purchasingpower.codegen.model.constraint.PositionRequirement;
import com.purchasingpower.codegen.model.constraint.ReturnConstraint;
import com.purchasingpower.codegen.model.constraint.ReturnRequirement;
import com.purchasingpower.codegen.model.ir.AssertClause;
import com.purchasingpower.codegen.model.ir.EffectClause;
import com.purchasingpower.codegen.model.ir.IntermediateRepresentation;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Keyword-based constraint detection.
 *
 * <p><b>Detection rules:</b>
 * <ul>
 *   <li>Return: the signature returns a value, the text mentions a computation, and the
 *       effects do not already say "return".
 *   <li>Loop behavior: a loop keyword plus a first / last / all keyword, checked in that
 *       order. FIRST_MATCH implies EARLY_RETURN, anything else ACCUMULATE.
 *   <li>Position: only when a position keyword is present. Email text yields
 *       {@code ['@', '.']} NOT_ADJACENT, bracket text yields {@code ['(', ')']} ORDERED,
 *       and quoted pairs around "not adjacent" yield their own NOT_ADJACENT constraint.
 * </ul>
 *
 * <p>Every rule requires an explicit keyword hit.
 *
 * <p><b>Thread Safety:</b> This implementation is thread-safe.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
public class ConstraintDetectorImpl implements ConstraintDetector {

    private static final Pattern QUOTED_ADJACENCY = Pattern.compile(
            "['\"](\\S+?)['\"].*not adjacent.*['\"](\\S+?)['\"]");

    private final DetectionKeywords keywords;
    private final List<Pattern> loopVariablePatterns;

    public ConstraintDetectorImpl(DetectionKeywords keywords) {
        this.keywords = Preconditions.checkNotNull(keywords, "Detection keywords cannot be null");
        this.loopVariablePatterns = keywords.getLoopVariablePatterns().stream()
                .map(Pattern::compile)
                .collect(Collectors.toList());
    }

    @Override
    public List<Constraint> detect(IntermediateRepresentation ir) {
        if (ir == null) {
            return List.of();
        }
        try {
            List<Constraint> constraints = new ArrayList<>();
            detectReturnConstraint(ir).ifPresent(constraints::add);
            detectLoopConstraint(ir).ifPresent(constraints::add);
            constraints.addAll(detectPositionConstraints(ir));

            log.info("🔍 Detected {} constraint(s) for '{}': {}",
                    constraints.size(),
                    ir.getSignature().getName(),
                    constraints.stream().map(c -> c.getKind().getWireName()).collect(Collectors.toList()));
            return constraints;
        } catch (RuntimeException e) {
            log.warn("Constraint detection failed, continuing without constraints", e);
            return List.of();
        }
    }

    @Override
    public List<Constraint> detectAndAttach(IntermediateRepresentation ir) {
        Preconditions.checkNotNull(ir, "IR cannot be null");
        if (ir.isConstraintsAttached()) {
            log.debug("Constraints already attached to '{}', skipping detection", ir.getSignature().getName());
            return ir.getConstraints();
        }
        try {
            ir.attachConstraints(detect(ir));
        } catch (IllegalStateException e) {
            log.debug("Constraints were attached concurrently to '{}'", ir.getSignature().getName());
        }
        return ir.getConstraints();
    }

    private Optional<Constraint> detectReturnConstraint(IntermediateRepresentation ir) {
        if (!ir.getSignature().returnsValue()) {
            return Optional.empty();
        }
        String intentText = intentText(ir);
        String effectsText = effectsText(ir);
        String combined = intentText + " " + effectsText;

        if (!containsAny(combined, keywords.getComputationKeywords())) {
            return Optional.empty();
        }
        if (effectsText.contains("return")) {
            // stated explicitly, unlikely to be dropped
            return Optional.empty();
        }

        String valueName = keywords.getValueNames().stream()
                .filter(combined::contains)
                .findFirst()
                .orElse("result");

        return Optional.of(ReturnConstraint.builder()
                .valueName(valueName)
                .requirement(ReturnRequirement.MUST_RETURN)
                .description(String.format("Function must return the computed '%s' value explicitly", valueName))
                .build());
    }

    private Optional<Constraint> detectLoopConstraint(IntermediateRepresentation ir) {
        String effectsText = effectsText(ir);
        String combined = intentText(ir) + " " + effectsText;

        if (!containsAny(combined, keywords.getLoopKeywords())) {
            return Optional.empty();
        }

        LoopSearchType searchType;
        if (containsAny(combined, keywords.getFirstMatchKeywords())) {
            searchType = LoopSearchType.FIRST_MATCH;
        } else if (containsAny(combined, keywords.getLastMatchKeywords())) {
            searchType = LoopSearchType.LAST_MATCH;
        } else if (containsAny(combined, keywords.getAllMatchesKeywords())) {
            searchType = LoopSearchType.ALL_MATCHES;
        } else {
            return Optional.empty();
        }

        return Optional.of(LoopBehaviorConstraint.builder()
                .searchType(searchType)
                .requirement(LoopRequirement.forSearchType(searchType))
                .loopVariable(extractLoopVariable(effectsText))
                .build());
    }

    private List<PositionConstraint> detectPositionConstraints(IntermediateRepresentation ir) {
        String combined = intentText(ir) + " " + effectsText(ir) + " " + assertionsText(ir);
        List<PositionConstraint> constraints = new ArrayList<>();

        if (!containsAny(combined, keywords.getPositionKeywords())) {
            return constraints;
        }

        if (containsAny(combined, keywords.getEmailKeywords())) {
            constraints.add(PositionConstraint.builder()
                    .elements(List.of("@", "."))
                    .requirement(PositionRequirement.NOT_ADJACENT)
                    .minDistance(1)
                    .description("@ and . must not be immediately adjacent (e.g., reject 'test@.com')")
                    .build());
        }

        if (containsAny(combined, keywords.getBracketKeywords())) {
            constraints.add(PositionConstraint.builder()
                    .elements(List.of("(", ")"))
                    .requirement(PositionRequirement.ORDERED)
                    .description("Opening parenthesis must appear before closing parenthesis")
                    .build());
        }

        Matcher matcher = QUOTED_ADJACENCY.matcher(combined);
        while (matcher.find()) {
            List<String> pair = List.of(matcher.group(1), matcher.group(2));
            boolean duplicate = constraints.stream()
                    .map(PositionConstraint::getElements)
                    .anyMatch(pair::equals);
            if (!duplicate) {
                constraints.add(PositionConstraint.builder()
                        .elements(pair)
                        .requirement(PositionRequirement.NOT_ADJACENT)
                        .minDistance(1)
                        .description(String.format("'%s' and '%s' must not be immediately adjacent",
                                pair.get(0), pair.get(1)))
                        .build());
            }
        }
        return constraints;
    }

    private String extractLoopVariable(String effectsText) {
        for (Pattern pattern : loopVariablePatterns) {
            Matcher matcher = pattern.matcher(effectsText);
            if (matcher.find()) {
                return matcher.group(1);
            }
        }
        return null;
    }

    private static boolean containsAny(String text, List<String> candidates) {
        for (String candidate : candidates) {
            if (text.contains(candidate)) {
                return true;
            }
        }
        return false;
    }

    private static String intentText(IntermediateRepresentation ir) {
        String summary = Strings.nullToEmpty(ir.getIntent().getSummary());
        String rationale = Strings.nullToEmpty(ir.getIntent().getRationale());
        return (summary + " " + rationale).toLowerCase(Locale.ROOT);
    }

    private static String effectsText(IntermediateRepresentation ir) {
        return ir.getEffects().stream()
                .map(EffectClause::getDescription)
                .map(Strings::nullToEmpty)
                .collect(Collectors.joining(" "))
                .toLowerCase(Locale.ROOT);
    }

    private static String assertionsText(IntermediateRepresentation ir) {
        return ir.getAssertions().stream()
                .map((AssertClause a) -> Strings.nullToEmpty(a.getPredicate()) + " " + Strings.nullToEmpty(a.getRationale()))
                .collect(Collectors.joining(" "))
                .toLowerCase(Locale.ROOT);
    }
}
