package com.purchasingpower.codegen.config;

import com.purchasingpower.codegen.configuration.DetectionProperties;
import com.purchasingpower.codegen.configuration.GenerationProperties;
import com.purchasingpower.codegen.configuration.LlmProperties;
import com.purchasingpower.codegen.configuration.TestingProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Registers every {@code @ConfigurationProperties} class of the application.
 *
 * <p>Enabled configuration classes:
 * <ul>
 *   <li>{@link GenerationProperties} - attempts, temperature schedule, best-of-N
 *   <li>{@link DetectionProperties} - detector keyword overrides
 *   <li>{@link TestingProperties} - sandboxed test execution
 *   <li>{@link LlmProperties} - Ollama chat model connection
 * </ul>
 *
 * @since 1.0.0
 */
@Configuration
@EnableConfigurationProperties({
    GenerationProperties.class,
    DetectionProperties.class,
    TestingProperties.class,
    LlmProperties.class
})
public class ConfigurationPropertiesEnablerConfig {
}
