package com.example.scenariogen.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A user story in the "As a ..., I want ... so that ..." form.
 *
 * @param role     Who wants the capability
 * @param goal     What they want
 * @param benefit  Why they want it
 * @param fullText The story exactly as it appeared in the source
 */
public record UserStory(
        String role,
        String goal,
        String benefit,
        @JsonProperty("full_text") String fullText
) {}
