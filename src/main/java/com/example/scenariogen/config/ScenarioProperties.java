package com.example.scenariogen.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for scenario generation. Bound once at startup.
 *
 * @param defaultNumScenarios Scenarios requested when the caller gives no count
 * @param defaultDetailLevel  Detail level used when the caller gives none
 * @param outputDir           Directory for JSON result artifacts
 * @param llm                 Model call settings
 * @param extractionService   Binary document extraction service
 */
@ConfigurationProperties(prefix = "scenario")
public record ScenarioProperties(
        Integer defaultNumScenarios,
        String defaultDetailLevel,
        String outputDir,
        Llm llm,
        ExtractionService extractionService
) {

    public ScenarioProperties {
        if (defaultNumScenarios == null) defaultNumScenarios = 5;
        if (defaultDetailLevel == null || defaultDetailLevel.isBlank()) defaultDetailLevel = "medium";
        if (outputDir == null || outputDir.isBlank()) outputDir = "scenario-output";
        if (llm == null) llm = new Llm(null, null, null);
        if (extractionService == null) extractionService = new ExtractionService(null);
    }

    /** Properties with every value at its default. */
    public static ScenarioProperties defaults() {
        return new ScenarioProperties(null, null, null, null, null);
    }

    /**
     * Settings for the scenario generation call.
     *
     * @param temperature  Sampling temperature
     * @param maxRetries   Extra attempts after a failed call
     * @param retryBackoff Base delay between attempts, multiplied by the attempt number
     */
    public record Llm(Double temperature, Integer maxRetries, Duration retryBackoff) {
        public Llm {
            if (temperature == null) temperature = 0.4;
            if (maxRetries == null || maxRetries < 0) maxRetries = 2;
            if (retryBackoff == null) retryBackoff = Duration.ofSeconds(2);
        }
    }

    /**
     * Service that turns PDF and Office documents into plain text.
     *
     * @param baseUrl base URL of the service (e.g. http://localhost:5001)
     */
    public record ExtractionService(String baseUrl) {
        public ExtractionService {
            if (baseUrl == null || baseUrl.isBlank()) baseUrl = "http://localhost:5001";
        }
    }
}
