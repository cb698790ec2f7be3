package com.example.scenariogen.ingestion;

import com.example.scenariogen.exception.IngestionException;
import com.example.scenariogen.model.RequirementSet;

/**
 * Extracts requirements from free text.
 */
public interface TextRequirementSource {

    /**
     * @throws IngestionException if the text yields no requirement set
     */
    RequirementSet extract(String text);
}
