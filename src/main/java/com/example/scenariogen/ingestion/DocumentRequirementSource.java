package com.example.scenariogen.ingestion;

import com.example.scenariogen.exception.IngestionException;
import com.example.scenariogen.model.RequirementSet;

import java.nio.file.Path;

/**
 * Extracts requirements from a document on disk.
 */
public interface DocumentRequirementSource {

    /**
     * @throws IngestionException if the document cannot be read or parsed
     */
    RequirementSet extract(Path path);
}
