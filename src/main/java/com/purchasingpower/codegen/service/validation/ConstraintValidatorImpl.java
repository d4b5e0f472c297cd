package com.purchasingpower.codegen.service.validation;

import com.purchasingpower.codegen.ast.ParsedSource;
import com.purchasingpower.codegen.ast.SourceNode;
import com.purchasingpower.codegen.ast.SourceParseException;
import com.purchasingpower.codegen.ast.SourceParser;
import com.purchasingpower.codegen.model.constraint.Constraint;
import com.purchasingpower.codegen.model.constraint.ConstraintViolation;
import com.purchasingpower.codegen.model.ir.IntermediateRepresentation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Validates candidates by static analysis of their AST.
 *
 * <p>Flow: parse, locate the target function, then run one structural check per
 * attached constraint through {@link StructuralChecks}. The checks only recognise
 * shapes; they stay silent on code they cannot classify.
 *
 * <p><b>Thread Safety:</b> This implementation is stateless and thread-safe.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConstraintValidatorImpl implements ConstraintValidator {

    private final SourceParser sourceParser;

    @Override
    public List<ConstraintViolation> validate(String code, IntermediateRepresentation ir) {
        if (code == null || ir == null) {
            return List.of(ConstraintViolation.syntaxError("No code to validate", null));
        }
        long start = System.currentTimeMillis();

        ParsedSource parsed;
        try {
            parsed = sourceParser.parse(code);
        } catch (SourceParseException e) {
            log.debug("Candidate does not parse: {}", e.getMessage());
            return List.of(ConstraintViolation.syntaxError(
                    "Code has syntax error: " + e.getMessage(), e.getLineNumber()));
        } catch (RuntimeException e) {
            log.warn("Parser failed unexpectedly on candidate", e);
            return List.of(ConstraintViolation.syntaxError("Code could not be parsed: " + e.getMessage(), null));
        }

        String functionName = ir.getSignature().getName();
        Optional<SourceNode> function = parsed.findFunction(functionName);
        if (function.isEmpty()) {
            return List.of(ConstraintViolation.missingFunction(functionName));
        }

        List<ConstraintViolation> violations = new ArrayList<>();
        StructuralChecks checks = new StructuralChecks(function.get());
        for (Constraint constraint : ir.getConstraints()) {
            try {
                violations.addAll(constraint.accept(checks));
            } catch (RuntimeException e) {
                log.warn("Check for {} failed on '{}', treating as satisfied",
                        constraint.getKind().getWireName(), functionName, e);
            }
        }

        log.debug("Validated '{}' against {} constraint(s) in {}ms: {} violation(s)",
                functionName, ir.getConstraints().size(), System.currentTimeMillis() - start, violations.size());
        return violations;
    }
}
