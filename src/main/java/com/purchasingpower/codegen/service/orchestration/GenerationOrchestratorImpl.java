package com.purchasingpower.codegen.service.orchestration;

import com.google.common.base.Preconditions;
import com.purchasingpower.codegen.client.CodeGenerator;
import com.purchasingpower.codegen.configuration.AsyncConfig;
import com.purchasingpower.codegen.configuration.GenerationProperties;
import com.purchasingpower.codegen.model.constraint.Constraint;
import com.purchasingpower.codegen.model.constraint.ConstraintViolation;
import com.purchasingpower.codegen.model.ir.IntermediateRepresentation;
import com.purchasingpower.codegen.service.detection.ConstraintDetector;
import com.purchasingpower.codegen.service.repair.ASTRepairEngine;
import com.purchasingpower.codegen.service.repair.RepairContext;
import com.purchasingpower.codegen.service.repair.RepairResult;
import com.purchasingpower.codegen.service.testing.TestCase;
import com.purchasingpower.codegen.service.testing.TestCaseGenerator;
import com.purchasingpower.codegen.service.testing.TestExecutor;
import com.purchasingpower.codegen.service.testing.TestResult;
import com.purchasingpower.codegen.service.validation.ConstraintValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Constraint-guided generation loop.
 *
 * <p><b>Per attempt:</b>
 * <pre>
 * PROMPT_BUILD → EXTERNAL_GENERATE → AST_REPAIR → CONSTRAINT_VALIDATE → TEST_EXECUTE
 *     → ACCEPTED | RETRY | EXHAUSTED
 * </pre>
 * Constraints are detected and attached once per IR and tests are derived once; every
 * attempt and candidate is judged against the same set.
 *
 * <p><b>Acceptance:</b> zero blocking violations and every test passing. The first
 * accepted candidate ends the run. When attempts run out, the best candidate over all
 * attempts (per {@code app.generation.selection-order}) is returned unvalidated, with a
 * warning for every unresolved violation and failing test.
 *
 * <p><b>Best-of-N:</b> with {@code candidates-per-attempt > 1} the candidates of one
 * attempt are generated and evaluated in parallel on the candidate executor.
 *
 * <p>Generator failures only disqualify their candidate; they never abort the run.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
public class GenerationOrchestratorImpl implements GenerationOrchestrator {

    private final ConstraintDetector detector;
    private final ConstraintValidator validator;
    private final ASTRepairEngine repairEngine;
    private final CodeGenerator codeGenerator;
    private final TestCaseGenerator testCaseGenerator;
    private final TestExecutor testExecutor;
    private final GenerationPromptBuilder promptBuilder;
    private final GenerationProperties properties;
    private final Executor candidateExecutor;

    @Autowired
    public GenerationOrchestratorImpl(ConstraintDetector detector,
                                      ConstraintValidator validator,
                                      ASTRepairEngine repairEngine,
                                      CodeGenerator codeGenerator,
                                      TestCaseGenerator testCaseGenerator,
                                      TestExecutor testExecutor,
                                      GenerationPromptBuilder promptBuilder,
                                      GenerationProperties properties,
                                      @Qualifier(AsyncConfig.CANDIDATE_EXECUTOR) Executor candidateExecutor) {
        this.detector = detector;
        this.validator = validator;
        this.repairEngine = repairEngine;
        this.codeGenerator = codeGenerator;
        this.testCaseGenerator = testCaseGenerator;
        this.testExecutor = testExecutor;
        this.promptBuilder = promptBuilder;
        this.properties = properties;
        this.candidateExecutor = candidateExecutor;
    }

    @Override
    public GenerationResult generate(IntermediateRepresentation ir) {
        return generate(ir, properties.getMaxAttempts());
    }

    @Override
    public GenerationResult generate(IntermediateRepresentation ir, int maxAttempts) {
        Preconditions.checkNotNull(ir, "IR cannot be null");
        Preconditions.checkArgument(maxAttempts >= 1, "Max attempts must be >= 1, got %s", maxAttempts);

        String functionName = ir.getSignature().getName();
        List<Constraint> constraints = detector.detectAndAttach(ir);
        List<TestCase> testCases = testCaseGenerator.generateTests(ir);
        RepairContext repairContext = RepairContext.of(constraints);
        Comparator<GenerationAttempt> ranking = SelectionCriterion.ordering(properties.getSelectionOrder());

        log.info("🚀 Generating '{}' with {} constraint(s), {} test(s), up to {} attempt(s)",
                functionName, constraints.size(), testCases.size(), maxAttempts);

        GenerationAttempt overallBest = null;
        GenerationAttempt previous = null;
        int candidatesEvaluated = 0;

        for (int attempt = 1; ; attempt++) {
            double temperature = properties.temperatureFor(attempt);
            log.info("🔄 Attempt {}/{} for '{}' (temperature {})", attempt, maxAttempts, functionName, temperature);

            transition(attempt, GenerationState.PROMPT_BUILD);
            String prompt = promptBuilder.build(ir, constraints, previous);

            CandidateJob job = new CandidateJob(ir, prompt, attempt, temperature, repairContext, testCases);
            List<GenerationAttempt> candidates = evaluateCandidates(job);
            candidatesEvaluated += candidates.size();

            Optional<GenerationAttempt> accepted = candidates.stream()
                    .filter(GenerationAttempt::isAccepted)
                    .min(ranking);
            if (accepted.isPresent()) {
                transition(attempt, GenerationState.ACCEPTED);
                log.info("✅ '{}' accepted on {}", functionName, accepted.get().label());
                return accepted(accepted.get(), attempt, candidatesEvaluated);
            }

            GenerationAttempt attemptBest = candidates.stream().min(ranking).orElseThrow();
            if (overallBest == null || ranking.compare(attemptBest, overallBest) < 0) {
                overallBest = attemptBest;
            }
            previous = attemptBest;

            GenerationState outcome = attempt < maxAttempts ? GenerationState.RETRY : GenerationState.EXHAUSTED;
            transition(attempt, outcome);
            log.warn("❌ Attempt {} rejected: best candidate has {} blocking violation(s), {}/{} test(s) passed",
                    attempt, attemptBest.hasCode() ? attemptBest.getErrorCount() : "n/a",
                    attemptBest.getTestsPassed(), attemptBest.getTestsTotal());

            if (outcome.isTerminal()) {
                log.warn("⚠️ Exhausted {} attempt(s) for '{}', returning best candidate unvalidated",
                        maxAttempts, functionName);
                return exhausted(overallBest, maxAttempts, candidatesEvaluated);
            }
        }
    }

    private List<GenerationAttempt> evaluateCandidates(CandidateJob job) {
        int count = properties.getCandidatesPerAttempt();
        if (count <= 1) {
            return List.of(evaluate(job, 0));
        }

        List<CompletableFuture<GenerationAttempt>> futures = IntStream.range(0, count)
                .mapToObj(index -> submit(job, index))
                .collect(Collectors.toList());

        return futures.stream().map(CompletableFuture::join).collect(Collectors.toList());
    }

    private CompletableFuture<GenerationAttempt> submit(CandidateJob job, int index) {
        try {
            return CompletableFuture.supplyAsync(() -> evaluate(job, index), candidateExecutor)
                    .exceptionally(e -> GenerationAttempt.failed(job.attempt(), index, job.temperature(),
                            unwrap(e).getMessage()));
        } catch (RejectedExecutionException e) {
            log.warn("❌ Candidate executor rejected attempt {} candidate {}: {}", job.attempt(), index, e.getMessage());
            return CompletableFuture.completedFuture(GenerationAttempt.failed(job.attempt(), index, job.temperature(),
                    "candidate rejected by executor: " + e.getMessage()));
        }
    }

    /**
     * Runs one candidate through generate, repair, validate and test.
     */
    private GenerationAttempt evaluate(CandidateJob job, int candidateIndex) {
        String functionName = job.ir().getSignature().getName();
        GenerationAttempt.GenerationAttemptBuilder result = GenerationAttempt.builder()
                .attemptNumber(job.attempt())
                .candidateIndex(candidateIndex)
                .temperature(job.temperature());

        transition(job.attempt(), GenerationState.EXTERNAL_GENERATE);
        String rawCode;
        try {
            rawCode = codeGenerator.generateCode(job.prompt(), job.temperature());
        } catch (RuntimeException e) {
            log.warn("❌ Generator failed for attempt {} candidate {}: {}", job.attempt(), candidateIndex, e.getMessage());
            return GenerationAttempt.failed(job.attempt(), candidateIndex, job.temperature(),
                    e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
        if (rawCode == null) {
            return GenerationAttempt.failed(job.attempt(), candidateIndex, job.temperature(), "generator returned no code");
        }

        transition(job.attempt(), GenerationState.AST_REPAIR);
        RepairResult repaired = repairEngine.repair(rawCode, functionName, job.repairContext());

        transition(job.attempt(), GenerationState.CONSTRAINT_VALIDATE);
        List<ConstraintViolation> violations = validator.validate(repaired.getCode(), job.ir());

        transition(job.attempt(), GenerationState.TEST_EXECUTE);
        List<TestResult> testResults = runTests(repaired.getCode(), functionName, job.testCases(), violations);

        GenerationAttempt attempt = result
                .rawCode(rawCode)
                .code(repaired.getCode())
                .appliedRepairs(repaired.getAppliedFixes())
                .violations(violations)
                .testResults(testResults)
                .build();
        log.info("🔍 {}: {} repair(s), {} blocking violation(s), {}/{} test(s) passed",
                attempt.label(), repaired.getAppliedFixes().size(), attempt.getErrorCount(),
                attempt.getTestsPassed(), attempt.getTestsTotal());
        return attempt;
    }

    private List<TestResult> runTests(String code, String functionName, List<TestCase> testCases,
                                      List<ConstraintViolation> violations) {
        if (testCases.isEmpty()) {
            return List.of();
        }
        Optional<ConstraintViolation> unrunnable = violations.stream()
                .filter(v -> ConstraintViolation.SYNTAX_ERROR.equals(v.getKind())
                        || ConstraintViolation.MISSING_FUNCTION.equals(v.getKind()))
                .findFirst();
        if (unrunnable.isPresent()) {
            String reason = "not run: " + unrunnable.get().getMessage();
            return testCases.stream()
                    .map(testCase -> TestResult.error(testCase, reason, 0))
                    .collect(Collectors.toList());
        }
        return testExecutor.executeAll(code, functionName, testCases);
    }

    private GenerationResult accepted(GenerationAttempt winner, int attemptsUsed, int candidatesEvaluated) {
        List<String> warnings = winner.getViolations().stream()
                .map(ConstraintViolation::toShortString)
                .collect(Collectors.toList());

        GenerationMetadata metadata = GenerationMetadata.builder()
                .validated(true)
                .attemptsUsed(attemptsUsed)
                .testsPassed(winner.getTestsPassed())
                .testsTotal(winner.getTestsTotal())
                .appliedRepairs(winner.getAppliedRepairs())
                .warnings(warnings)
                .bestAttempt(winner.getAttemptNumber())
                .candidatesEvaluated(candidatesEvaluated)
                .build();
        return new GenerationResult(winner.getCode(), metadata);
    }

    private GenerationResult exhausted(GenerationAttempt best, int attemptsUsed, int candidatesEvaluated) {
        List<String> warnings = new ArrayList<>();

        if (best == null || !best.hasCode()) {
            warnings.add("No candidate code was produced in " + attemptsUsed + " attempt(s)"
                    + (best != null ? ": " + best.getGenerationError() : ""));
            GenerationMetadata metadata = GenerationMetadata.builder()
                    .validated(false)
                    .attemptsUsed(attemptsUsed)
                    .warnings(warnings)
                    .candidatesEvaluated(candidatesEvaluated)
                    .build();
            return new GenerationResult("", metadata);
        }

        warnings.add(String.format("Code not validated after %d attempt(s); returning best candidate from attempt %d",
                attemptsUsed, best.getAttemptNumber()));
        best.getViolations().stream()
                .map(v -> (v.isBlocking() ? "Unresolved: " : "") + v.toShortString())
                .forEach(warnings::add);
        best.getTestResults().stream()
                .filter(result -> !result.isPassed())
                .map(TestResult::describeFailure)
                .forEach(warnings::add);

        GenerationMetadata metadata = GenerationMetadata.builder()
                .validated(false)
                .attemptsUsed(attemptsUsed)
                .testsPassed(best.getTestsPassed())
                .testsTotal(best.getTestsTotal())
                .appliedRepairs(best.getAppliedRepairs())
                .warnings(warnings)
                .bestAttempt(best.getAttemptNumber())
                .candidatesEvaluated(candidatesEvaluated)
                .build();
        return new GenerationResult(best.getCode(), metadata);
    }

    private void transition(int attempt, GenerationState state) {
        log.debug("[attempt {}] → {}", attempt, state);
    }

    private Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }

    private record CandidateJob(IntermediateRepresentation ir, String prompt, int attempt, double temperature,
                                RepairContext repairContext, List<TestCase> testCases) {
    }
}
