package com.example.scenariogen.agent;

import com.example.scenariogen.exception.GenerationException;
import com.example.scenariogen.model.DetailLevel;
import com.example.scenariogen.model.RequirementSet;
import com.example.scenariogen.model.ScenarioGenerationResponse;

/**
 * Produces scenario drafts for a requirement set using a generative model.
 */
public interface GenerationClient {

    /**
     * @param requirements requirement set to cover
     * @param numScenarios number of scenarios to ask for; not validated here
     * @param detailLevel  detail level to ask for
     * @return drafts, raw completion and generation metadata
     * @throws GenerationException if the model could not be reached or returned nothing
     */
    ScenarioGenerationResponse generate(RequirementSet requirements, int numScenarios, DetailLevel detailLevel);
}
