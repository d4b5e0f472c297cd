package com.purchasingpower.codegen.configuration;

import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Sandboxed test execution settings ({@code app.testing}).
 */
@Data
@Validated
@ConfigurationProperties(prefix = "app.testing")
public class TestingProperties {

    /**
     * Wall-clock limit for a single test case; exceeding it fails the test.
     */
    @Min(1)
    private long timeoutMs = 1000;

    /**
     * Extra time granted to the child JVM for start-up and shutdown before it is killed.
     */
    @Min(0)
    private long startupGraceMs = 5000;

    /**
     * Heap limit of the child JVM running a test case.
     */
    @Min(16)
    private int maxHeapMb = 64;
}
