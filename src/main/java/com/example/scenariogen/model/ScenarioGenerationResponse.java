package com.example.scenariogen.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * What the generation client hands back for one call.
 *
 * @param scenarios      Drafts parsed from the completion, in model order
 * @param metadata       Generation metadata (model, timings, counts)
 * @param rawLlmResponse Unmodified completion text
 */
public record ScenarioGenerationResponse(
        List<ScenarioDraft> scenarios,
        Map<String, Object> metadata,
        String rawLlmResponse
) {
    public ScenarioGenerationResponse {
        scenarios = scenarios != null ? List.copyOf(scenarios) : List.of();
        metadata = metadata != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata))
                : Map.of();
        rawLlmResponse = rawLlmResponse != null ? rawLlmResponse : "";
    }
}
