package com.example.scenariogen.ingestion;

import com.example.scenariogen.exception.IngestionException;
import com.example.scenariogen.model.RequirementSet;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Extracts requirements from an issue-tracker export.
 */
public interface IssueExportRequirementSource {

    /**
     * @throws IngestionException if the payload holds no usable issue
     */
    RequirementSet extract(JsonNode payload);
}
