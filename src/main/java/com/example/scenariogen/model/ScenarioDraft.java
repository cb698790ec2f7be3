package com.example.scenariogen.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Scenario as returned by the model, before enrichment.
 * Any field may be null: the model's output shape is not guaranteed.
 *
 * @param id                  Scenario identifier proposed by the model
 * @param title               Short title
 * @param description         What the scenario verifies
 * @param relatedRequirements Free-form, comma separated requirement ids
 * @param priority            High / Medium / Low, as written by the model
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ScenarioDraft(
        String id,
        String title,
        String description,
        @JsonProperty("related_requirements") String relatedRequirements,
        String priority
) {}
