package com.purchasingpower.codegen.config;

import com.purchasingpower.codegen.configuration.DetectionProperties;
import com.purchasingpower.codegen.service.detection.DetectionKeywords;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;
import java.util.function.Consumer;

/**
 * Builds the detector's keyword tables from the defaults plus any {@code app.detection}
 * overrides.
 */
@Configuration
public class DetectionConfig {

    @Bean
    public DetectionKeywords detectionKeywords(DetectionProperties properties) {
        DetectionKeywords.DetectionKeywordsBuilder builder = DetectionKeywords.defaults().toBuilder();
        override(properties.getComputationKeywords(), builder::computationKeywords);
        override(properties.getValueNames(), builder::valueNames);
        override(properties.getLoopKeywords(), builder::loopKeywords);
        override(properties.getFirstMatchKeywords(), builder::firstMatchKeywords);
        override(properties.getLastMatchKeywords(), builder::lastMatchKeywords);
        override(properties.getAllMatchesKeywords(), builder::allMatchesKeywords);
        override(properties.getPositionKeywords(), builder::positionKeywords);
        override(properties.getEmailKeywords(), builder::emailKeywords);
        override(properties.getBracketKeywords(), builder::bracketKeywords);
        override(properties.getLoopVariablePatterns(), builder::loopVariablePatterns);
        return builder.build();
    }

    private void override(List<String> configured, Consumer<List<String>> setter) {
        if (configured != null && !configured.isEmpty()) {
            setter.accept(List.copyOf(configured));
        }
    }
}
