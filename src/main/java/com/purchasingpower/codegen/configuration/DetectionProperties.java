package com.purchasingpower.codegen.configuration;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;

/**
 * Optional overrides of the detector's keyword tables ({@code app.detection}).
 * A table left unset keeps its built-in default.
 */
@Data
@ConfigurationProperties(prefix = "app.detection")
public class DetectionProperties {

    private List<String> computationKeywords;
    private List<String> valueNames;
    private List<String> loopKeywords;
    private List<String> firstMatchKeywords;
    private List<String> lastMatchKeywords;
    private List<String> allMatchesKeywords;
    private List<String> positionKeywords;
    private List<String> emailKeywords;
    private List<String> bracketKeywords;
    private List<String> loopVariablePatterns;
}
