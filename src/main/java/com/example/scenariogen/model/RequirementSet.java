package com.example.scenariogen.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Normalized requirements produced by an ingestion collaborator.
 * Read-only for the rest of the pipeline.
 *
 * @param source             Where the set came from (text, pdf, docx, jira, ...)
 * @param rawText            Source text the set was extracted from
 * @param requirements       Requirements in source order
 * @param userStories        User stories found in the source
 * @param acceptanceCriteria Acceptance criteria in source order
 */
public record RequirementSet(
        String source,
        @JsonProperty("raw_text") String rawText,
        List<Requirement> requirements,
        @JsonProperty("user_stories") List<UserStory> userStories,
        @JsonProperty("acceptance_criteria") List<String> acceptanceCriteria
) {
    public RequirementSet {
        source = source != null ? source : "unknown";
        rawText = rawText != null ? rawText : "";
        requirements = requirements != null ? List.copyOf(requirements) : List.of();
        userStories = userStories != null ? List.copyOf(userStories) : List.of();
        acceptanceCriteria = acceptanceCriteria != null ? List.copyOf(acceptanceCriteria) : List.of();
    }

    /** Set built directly from requirements, with no stories or criteria. */
    public static RequirementSet of(List<Requirement> requirements) {
        return new RequirementSet("requirements", "", requirements, List.of(), List.of());
    }

    public int totalRequirements() {
        return requirements.size();
    }

    /** True when neither requirements, stories nor criteria were extracted. */
    public boolean isUnstructured() {
        return requirements.isEmpty() && userStories.isEmpty() && acceptanceCriteria.isEmpty();
    }
}
