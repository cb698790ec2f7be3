package com.example.scenariogen.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Map;

/**
 * Final output of one orchestration call.
 *
 * @param scenarios      Enriched scenarios in model order, after priority filtering
 * @param metadata       Generation metadata plus {@code priority_focus} and {@code custom_focus}
 * @param rawLlmResponse The completion text exactly as the model returned it
 */
@JsonPropertyOrder({"scenarios", "metadata", "raw_llm_response"})
public record GenerationResult(
        List<Scenario> scenarios,
        Map<String, Object> metadata,
        @JsonProperty("raw_llm_response") String rawLlmResponse
) {}
