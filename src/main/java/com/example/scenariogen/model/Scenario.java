package com.example.scenariogen.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.util.List;

/**
 * Enriched test scenario: the draft fields plus derived metadata.
 *
 * @param id                  Scenario id, always prefixed with {@code TS-} when present
 * @param title               Short title
 * @param description         Whitespace-normalized description without markdown markers
 * @param relatedRequirements Requirement ids as written by the model
 * @param priority            Priority as written by the model
 * @param generationTimestamp Enrichment time, shared by every scenario of one call
 * @param focusAreas          Caller focus keywords found in the title or description
 * @param coverage            Requirement coverage claimed by the scenario
 * @param testType            Scenario intent
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"id", "title", "description", "related_requirements", "priority",
        "generation_timestamp", "focus_areas", "coverage", "test_type"})
public record Scenario(
        String id,
        String title,
        String description,
        @JsonProperty("related_requirements") String relatedRequirements,
        String priority,
        @JsonProperty("generation_timestamp") Instant generationTimestamp,
        @JsonProperty("focus_areas") List<String> focusAreas,
        Coverage coverage,
        @JsonProperty("test_type") TestType testType
) {
    public Scenario {
        focusAreas = focusAreas != null ? List.copyOf(focusAreas) : List.of();
        coverage = coverage != null ? coverage : Coverage.none();
        testType = testType != null ? testType : TestType.FUNCTIONAL;
    }
}
