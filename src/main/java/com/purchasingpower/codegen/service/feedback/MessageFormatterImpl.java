package com.purchasingpower.codegen.service.feedback;

import com.google.common.base.Strings;
import com.purchasingpower.codegen.model.constraint.Constraint;
import com.purchasingpower.codegen.model.constraint.ConstraintViolation;
import com.purchasingpower.codegen.model.constraint.ConstraintVisitor;
import com.purchasingpower.codegen.model.constraint.LoopBehaviorConstraint;
import com.purchasingpower.codegen.model.constraint.LoopRequirement;
import com.purchasingpower.codegen.model.constraint.LoopSearchType;
import com.purchasingpower.codegen.model.constraint.PositionConstraint;
import com.purchasingpower.codegen.model.constraint.ReturnConstraint;
import com.purchasingpower.codegen.service.testing.TestResult;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Feedback text optimised for LLM consumption: short section headers, plain language,
 * Java examples of the wrong and the fixed shape.
 *
 * <p><b>Thread Safety:</b> Stateless and thread-safe.
 *
 * @since 1.0.0
 */
@Service
public class MessageFormatterImpl implements MessageFormatter {

    private static final String RULE = "=".repeat(80);
    private static final String THIN_RULE = "-".repeat(80);

    @Override
    public String formatViolation(ConstraintViolation violation, Constraint constraint) {
        switch (Strings.nullToEmpty(violation.getKind())) {
            case ConstraintViolation.SYNTAX_ERROR:
                return formatSyntaxError(violation);
            case ConstraintViolation.MISSING_FUNCTION:
                return formatMissingFunction(violation);
            default:
                break;
        }
        if (constraint == null || !constraint.getKind().getWireName().equals(violation.getKind())) {
            return "Constraint violation: " + violation.getMessage();
        }
        return constraint.accept(new ViolationExplainer(violation));
    }

    @Override
    public String formatViolationsSummary(List<ConstraintViolation> violations, List<Constraint> constraints) {
        if (violations == null || violations.isEmpty()) {
            return "All constraints satisfied ✓";
        }

        Map<String, Constraint> byKind = new LinkedHashMap<>();
        if (constraints != null) {
            for (Constraint constraint : constraints) {
                byKind.putIfAbsent(constraint.getKind().getWireName(), constraint);
            }
        }

        List<ConstraintViolation> errors = violations.stream()
                .filter(ConstraintViolation::isBlocking)
                .collect(Collectors.toList());
        List<ConstraintViolation> advisories = violations.stream()
                .filter(v -> !v.isBlocking())
                .collect(Collectors.toList());

        StringBuilder sb = new StringBuilder();
        sb.append(RULE).append('\n')
                .append("CONSTRAINT VALIDATION FAILED\n")
                .append(RULE).append("\n\n");

        if (!errors.isEmpty()) {
            sb.append(String.format("Found %d ERROR(s) - must fix before code can be accepted:%n%n", errors.size()));
            for (int i = 0; i < errors.size(); i++) {
                ConstraintViolation error = errors.get(i);
                sb.append(String.format("ERROR %d/%d:%n", i + 1, errors.size()))
                        .append(THIN_RULE).append('\n')
                        .append(formatViolation(error, sourceOf(error, byKind)))
                        .append('\n');
            }
        }

        if (!advisories.isEmpty()) {
            sb.append(String.format("Found %d advisory issue(s) - recommended to fix:%n%n", advisories.size()));
            for (int i = 0; i < advisories.size(); i++) {
                ConstraintViolation advisory = advisories.get(i);
                sb.append(String.format("%s %d/%d: %s%n",
                        advisory.getSeverity().name(), i + 1, advisories.size(), advisory.getMessage()));
            }
            sb.append('\n');
        }

        sb.append(RULE).append('\n')
                .append("Please fix these violations in the next generation attempt.\n")
                .append(RULE);
        return sb.toString();
    }

    /**
     * The constraint a violation was raised for; violations built without one fall back
     * to the first constraint of the same kind.
     */
    private static Constraint sourceOf(ConstraintViolation violation, Map<String, Constraint> byKind) {
        return violation.getConstraint() != null ? violation.getConstraint() : byKind.get(violation.getKind());
    }

    @Override
    public String getConstraintHint(Constraint constraint) {
        return constraint.accept(new ConstraintVisitor<>() {
            @Override
            public String visitReturn(ReturnConstraint c) {
                return String.format("MUST explicitly return '%s' value (not null)", c.getValueName());
            }

            @Override
            public String visitLoopBehavior(LoopBehaviorConstraint c) {
                switch (c.getSearchType()) {
                    case FIRST_MATCH:
                        return "MUST use early return inside loop for FIRST match (not accumulate to last)";
                    case ALL_MATCHES:
                        return "MUST accumulate all matches (no early return)";
                    default:
                        return "MUST accumulate to find LAST match (no early return)";
                }
            }

            @Override
            public String visitPosition(PositionConstraint c) {
                String elements = c.describeElements(" and ");
                switch (c.getRequirement()) {
                    case NOT_ADJACENT:
                        return String.format("MUST check %s are NOT adjacent (distance > %d)", elements, c.getMinDistance());
                    case ORDERED:
                        return String.format("MUST check %s appear in this order", elements);
                    case MIN_DISTANCE:
                        return String.format("MUST check %s are at least %d apart", elements, c.getMinDistance());
                    default:
                        return String.format("MUST check %s are at most %s apart", elements, c.getMaxDistance());
                }
            }
        });
    }

    @Override
    public String formatTestFailures(String functionName, List<TestResult> results) {
        List<TestResult> failed = results.stream().filter(r -> !r.isPassed()).collect(Collectors.toList());
        if (failed.isEmpty()) {
            return "";
        }

        StringBuilder sb = new StringBuilder();
        sb.append(String.format("TEST EXECUTION FAILED: %d of %d test(s) failed%n%n", failed.size(), results.size()));

        for (TestResult result : failed) {
            String call = result.getTestCase().describeCall(functionName);
            if (result.isTimedOut()) {
                sb.append(String.format("- %s did not finish: %s%n", call, result.getError()));
            } else if (result.getActual() != null) {
                sb.append(String.format("- %s returned %s, expected %s%n",
                        call, result.getActual(), result.getTestCase().getExpected()));
            } else {
                sb.append(String.format("- %s raised an error: %s%n", call, result.getError()));
            }
        }

        sb.append('\n');
        if (failed.stream().anyMatch(TestResult::isTimedOut)) {
            sb.append("Check loop termination conditions; a loop that never exits is treated as a failure.\n");
        }
        if (failed.stream().anyMatch(r -> !r.isTimedOut() && r.getActual() == null)) {
            sb.append("Guard against null, empty and out-of-range inputs before indexing.\n");
        }
        if (failed.stream().anyMatch(r -> r.getActual() != null)) {
            sb.append("Trace the failing inputs by hand and compare each branch with the expected value.\n");
        }
        return sb.toString();
    }

    private static String formatSyntaxError(ConstraintViolation violation) {
        String line = violation.getLineNumber() == null ? "" : " (line " + violation.getLineNumber() + ")";
        return String.format("""
                Syntax Error: Code cannot be parsed%s

                What's wrong:
                  %s

                How to fix:
                  Return a single, complete Java method (or class) that compiles on its own.
                  Check for unbalanced braces, missing semicolons and stray Markdown fences.
                """, line, violation.getMessage());
    }

    private static String formatMissingFunction(ConstraintViolation violation) {
        return String.format("""
                Missing Function: Expected function not found

                What's wrong:
                  %s

                How to fix:
                  Ensure the generated code declares the required method with the exact name
                  from the signature.
                """, violation.getMessage());
    }

    /**
     * Long-form explanation for a constraint violation.
     */
    private static final class ViolationExplainer implements ConstraintVisitor<String> {

        private final ConstraintViolation violation;

        private ViolationExplainer(ConstraintViolation violation) {
            this.violation = violation;
        }

        @Override
        public String visitReturn(ReturnConstraint constraint) {
            String valueName = constraint.getValueName();
            String message = Strings.nullToEmpty(violation.getMessage());

            if (message.contains("No return statement")) {
                return String.format("""
                        ReturnConstraint violation: Missing return statement

                        What's wrong:
                          Method does not have a return statement, but it computes '%1$s'

                        Why it matters:
                          A computed value that is never returned is lost. The method either fails
                          to compile or hands the caller a default instead of the result.

                        How to fix:
                          Add 'return %1$s;' after computing the value

                        Example:
                          // Current (wrong):
                          int computeResult(int[] data) {
                              int %1$s = process(data);
                              // Missing return!
                          }

                          // Fixed (correct):
                          int computeResult(int[] data) {
                              int %1$s = process(data);
                              return %1$s;
                          }
                        """, valueName);
            }
            if (message.toLowerCase(Locale.ROOT).contains("return null")) {
                return String.format("""
                        ReturnConstraint violation: Returns null instead of computed value

                        What's wrong:
                          All return statements return null, but the method should return '%1$s'

                        Why it matters:
                          Returning null discards the computed result. The caller expects the value,
                          and a null usually surfaces later as a NullPointerException.

                        How to fix:
                          Return the computed '%1$s' value instead of null

                        Example:
                          // Current (wrong):
                          Integer computeResult(List<Integer> data) {
                              Integer %1$s = process(data);
                              return null;  // Wrong!
                          }

                          // Fixed (correct):
                          Integer computeResult(List<Integer> data) {
                              Integer %1$s = process(data);
                              return %1$s;
                          }
                        """, valueName);
            }
            return String.format("""
                    ReturnConstraint violation: %s

                    How to fix:
                      Ensure the method explicitly returns the computed '%s' value
                      Example: return %s;
                    """, message, valueName, valueName);
        }

        @Override
        public String visitLoopBehavior(LoopBehaviorConstraint constraint) {
            if (constraint.getSearchType() == LoopSearchType.FIRST_MATCH
                    && constraint.getRequirement() == LoopRequirement.EARLY_RETURN) {
                return """
                        LoopBehaviorConstraint violation: Missing early return for FIRST match

                        What's wrong:
                          Loop searches for the FIRST match but doesn't return immediately when found.
                          Instead, it keeps iterating and overwrites the result.

                        Why it matters:
                          Without an early return the loop ends on the LAST match, not the first.
                          This produces incorrect results (e.g. findIndex returns the wrong index).

                        How to fix:
                          Add a 'return' statement inside the loop when the match is found

                        Example:
                          // Current (wrong - finds LAST match):
                          int findFirst(int[] items, int target) {
                              int result = -1;
                              for (int i = 0; i < items.length; i++) {
                                  if (items[i] == target) {
                                      result = i;  // Overwritten by later matches!
                                  }
                              }
                              return result;
                          }

                          // Fixed (correct - finds FIRST match):
                          int findFirst(int[] items, int target) {
                              for (int i = 0; i < items.length; i++) {
                                  if (items[i] == target) {
                                      return i;  // Early return on first match!
                                  }
                              }
                              return -1;  // Default if not found
                          }
                        """;
            }
            return String.format("""
                    LoopBehaviorConstraint violation: Missing accumulation for %s

                    What's wrong:
                      %s

                    Why it matters:
                      An early return stops at the first match and misses later ones.
                      This produces incomplete results (e.g. findAllIndices returns only one index).

                    How to fix:
                      Accumulate matches in a collection or variable and return after the loop completes

                    Example:
                      // Current (wrong - returns first only):
                      List<Integer> findAll(int[] items, int target) {
                          for (int i = 0; i < items.length; i++) {
                              if (items[i] == target) {
                                  return List.of(i);  // Early return - wrong!
                              }
                          }
                          return List.of();
                      }

                      // Fixed (correct - finds all):
                      List<Integer> findAll(int[] items, int target) {
                          List<Integer> indices = new ArrayList<>();  // Accumulator
                          for (int i = 0; i < items.length; i++) {
                              if (items[i] == target) {
                                  indices.add(i);  // Accumulate
                              }
                          }
                          return indices;  // Return after loop
                      }
                    """, constraint.getSearchType() == LoopSearchType.ALL_MATCHES ? "ALL matches" : "LAST match",
                    violation.getMessage());
        }

        @Override
        public String visitPosition(PositionConstraint constraint) {
            String elements = constraint.describeElements(" and ");
            String first = constraint.getElements().isEmpty() ? "a" : constraint.getElements().get(0);
            String second = constraint.getElements().size() < 2 ? "b" : constraint.getElements().get(1);

            switch (constraint.getRequirement()) {
                case NOT_ADJACENT:
                    return String.format("""
                            PositionConstraint violation: Elements must not be adjacent

                            What's wrong:
                              Code validates that %1$s exist, but doesn't check they're not adjacent

                            Why it matters:
                              Adjacent elements let invalid inputs through (e.g. email validation
                              accepting "test@.com" where the dot immediately follows '@').

                            How to fix:
                              Add a position check ensuring the elements are at least %2$d characters apart

                            Example (for email validation):
                              // Current (wrong - accepts "test@.com"):
                              boolean isValid(String email) {
                                  return email.indexOf('@') < email.lastIndexOf('.');  // Order only!
                              }

                              // Fixed (correct - rejects "test@.com"):
                              boolean isValid(String email) {
                                  int at = email.indexOf('@');
                                  int dot = email.lastIndexOf('.');
                                  if (at == -1 || dot == -1) {
                                      return false;
                                  }
                                  return dot - at > %3$d;  // Check distance!
                              }
                            """, elements, constraint.getMinDistance() + 1, constraint.getMinDistance());
                case ORDERED:
                    return String.format("""
                            PositionConstraint violation: Elements must appear in order

                            What's wrong:
                              Code doesn't verify that %1$s appear in the required order

                            Why it matters:
                              Order matters for validity (e.g. a closing bracket before the opening one
                              is invalid even though both are present).

                            How to fix:
                              Compare positions so the first element appears before the next one

                            Example:
                              // Current (wrong):
                              boolean validate(String text) {
                                  return text.contains("%2$s") && text.contains("%3$s");
                              }

                              // Fixed (correct):
                              boolean validate(String text) {
                                  int first = text.indexOf("%2$s");
                                  int second = text.indexOf("%3$s");
                                  return first != -1 && second != -1 && first < second;
                              }
                            """, elements, first, second);
                case MIN_DISTANCE:
                    return String.format("""
                            PositionConstraint violation: Elements must be at least %1$d characters apart

                            What's wrong:
                              Code doesn't enforce a minimum distance of %1$d between %2$s

                            How to fix:
                              Add check: Math.abs(first - second) >= %1$d
                            """, constraint.getMinDistance(), elements);
                default:
                    return String.format("""
                            PositionConstraint violation: Elements must be at most %1$s characters apart

                            What's wrong:
                              Code doesn't enforce a maximum distance of %1$s between %2$s

                            How to fix:
                              Add check: Math.abs(first - second) <= %1$s
                            """, constraint.getMaxDistance(), elements);
            }
        }
    }
}
