package com.example.scenariogen.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Per-call knobs shared by every orchestrator entry point. Null means "not given".
 *
 * @param numScenarios  Number of scenarios to request; configured default when null
 * @param detailLevel   low / medium / high; anything else is coerced to medium
 * @param priorityFocus Keep only scenarios with this priority (case-insensitive)
 * @param customFocus   Keyword phrases to tag scenarios with
 */
public record GenerationOptions(
        Integer numScenarios,
        String detailLevel,
        String priorityFocus,
        List<String> customFocus
) {
    public GenerationOptions {
        customFocus = customFocus != null ? Collections.unmodifiableList(new ArrayList<>(customFocus)) : null;
    }

    public static GenerationOptions defaults() {
        return new GenerationOptions(null, null, null, null);
    }

    public GenerationOptions withNumScenarios(Integer value) {
        return new GenerationOptions(value, detailLevel, priorityFocus, customFocus);
    }

    public GenerationOptions withDetailLevel(String value) {
        return new GenerationOptions(numScenarios, value, priorityFocus, customFocus);
    }

    public GenerationOptions withPriorityFocus(String value) {
        return new GenerationOptions(numScenarios, detailLevel, value, customFocus);
    }

    public GenerationOptions withCustomFocus(List<String> value) {
        return new GenerationOptions(numScenarios, detailLevel, priorityFocus, value);
    }
}
