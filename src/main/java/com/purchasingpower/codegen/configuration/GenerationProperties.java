package com.purchasingpower.codegen.configuration;

import com.purchasingpower.codegen.service.orchestration.SelectionCriterion;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Retry, sampling and best-of-N settings for the generation loop.
 *
 * <p>Properties are loaded from the {@code app.generation} namespace in application.yml:
 * <pre>
 * app:
 *   generation:
 *     max-attempts: 3
 *     base-temperature: 0.3
 *     temperature-step: 0.15
 *     max-temperature: 0.9
 *     candidates-per-attempt: 1
 *     worker-pool-size: 4
 *     selection-order: [FEWEST_ERRORS, MOST_TESTS_PASSED, EARLIEST_ATTEMPT]
 * </pre>
 *
 * <p><b>Temperature Schedule:</b> attempt k (starting at 1) samples at
 * <pre>
 *   min(base-temperature + (k - 1) * temperature-step, max-temperature)
 * </pre>
 * With defaults: 0.3, 0.45, 0.6, then capped at 0.9.
 *
 * @since 1.0.0
 */
@Data
@Validated
@ConfigurationProperties(prefix = "app.generation")
public class GenerationProperties {

    /**
     * Attempts before giving up. Default: 3
     */
    @Min(1)
    private int maxAttempts = 3;

    @DecimalMin("0.0")
    private double baseTemperature = 0.3;

    @DecimalMin("0.0")
    private double temperatureStep = 0.15;

    @DecimalMax("2.0")
    private double maxTemperature = 0.9;

    /**
     * Candidates sampled per attempt. Values above 1 enable best-of-N selection.
     */
    @Min(1)
    private int candidatesPerAttempt = 1;

    /**
     * Threads evaluating candidates of one attempt in parallel.
     */
    @Min(1)
    private int workerPoolSize = 4;

    /**
     * Ordering used to rank candidates; candidate index breaks remaining ties.
     */
    @NotEmpty
    private List<SelectionCriterion> selectionOrder = new ArrayList<>(SelectionCriterion.DEFAULT_ORDER);

    public double temperatureFor(int attemptNumber) {
        return Math.min(baseTemperature + (attemptNumber - 1) * temperatureStep, maxTemperature);
    }
}
