package com.example.scenariogen.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Requirement coverage claimed by a scenario.
 *
 * @param requirementsCovered Requirement ids the scenario says it covers
 * @param coveragePercentage  Share of the requirement set covered (0-100)
 */
public record Coverage(
        @JsonProperty("requirements_covered") List<String> requirementsCovered,
        @JsonProperty("coverage_percentage") double coveragePercentage
) {
    public Coverage {
        requirementsCovered = requirementsCovered != null ? List.copyOf(requirementsCovered) : List.of();
    }

    public static Coverage none() {
        return new Coverage(List.of(), 0.0);
    }
}
