package com.example.scenariogen.orchestrator;

import com.example.scenariogen.agent.GenerationClient;
import com.example.scenariogen.config.ScenarioProperties;
import com.example.scenariogen.exception.GenerationException;
import com.example.scenariogen.exception.IngestionException;
import com.example.scenariogen.ingestion.DocumentRequirementSource;
import com.example.scenariogen.ingestion.IssueExportRequirementSource;
import com.example.scenariogen.ingestion.TextRequirementSource;
import com.example.scenariogen.model.DetailLevel;
import com.example.scenariogen.model.GenerationOptions;
import com.example.scenariogen.model.GenerationResult;
import com.example.scenariogen.model.RequirementSet;
import com.example.scenariogen.model.Scenario;
import com.example.scenariogen.model.ScenarioGenerationResponse;
import com.example.scenariogen.service.ResultAssembler;
import com.example.scenariogen.service.ScenarioEnricher;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Entry point for scenario generation.
 * Pipeline:
 * 1. Requirement set: given directly, or extracted from a document, an issue export or raw text
 * 2. Option resolution: default count and detail level, invalid detail level coerced to medium
 * 3. Generation: one call to the {@link GenerationClient}, no retry here
 * 4. Enrichment: priority filter, focus tags, coverage, ids, test type, description cleanup
 * 5. Assembly: scenarios + metadata + raw completion
 * <p>
 * Ingestion and generation failures propagate unchanged; no partial result is ever returned.
 * Holds no per-call state, so concurrent calls need no coordination.
 */
@Service
public class ScenarioOrchestrator {

    private final GenerationClient generationClient;
    private final DocumentRequirementSource documentSource;
    private final IssueExportRequirementSource issueExportSource;
    private final TextRequirementSource textSource;
    private final ScenarioEnricher enricher;
    private final ResultAssembler assembler;
    private final ScenarioProperties properties;
    private final Logger log;

    @Autowired
    public ScenarioOrchestrator(GenerationClient generationClient,
                                DocumentRequirementSource documentSource,
                                IssueExportRequirementSource issueExportSource,
                                TextRequirementSource textSource,
                                ScenarioEnricher enricher,
                                ResultAssembler assembler,
                                ScenarioProperties properties) {
        this(generationClient, documentSource, issueExportSource, textSource, enricher, assembler,
                properties, LoggerFactory.getLogger(ScenarioOrchestrator.class));
    }

    public ScenarioOrchestrator(GenerationClient generationClient,
                                DocumentRequirementSource documentSource,
                                IssueExportRequirementSource issueExportSource,
                                TextRequirementSource textSource,
                                ScenarioEnricher enricher,
                                ResultAssembler assembler,
                                ScenarioProperties properties,
                                Logger log) {
        this.generationClient = generationClient;
        this.documentSource = documentSource;
        this.issueExportSource = issueExportSource;
        this.textSource = textSource;
        this.enricher = enricher;
        this.assembler = assembler;
        this.properties = properties;
        this.log = log;
    }

    /**
     * Generates scenarios from an already extracted requirement set.
     *
     * @throws GenerationException if the generation client fails
     */
    public GenerationResult fromRequirements(RequirementSet requirements, GenerationOptions options) {
        Objects.requireNonNull(requirements, "requirements must not be null");
        log.info("Generating test scenarios from requirements ({} requirements)",
                requirements.totalRequirements());
        return generate(() -> requirements, options);
    }

    /**
     * Generates scenarios from a requirements document.
     *
     * @throws IngestionException  if the document cannot be processed
     * @throws GenerationException if the generation client fails
     */
    public GenerationResult fromDocument(Path documentPath, GenerationOptions options) {
        log.info("Generating test scenarios from document: {}", documentPath);
        return generate(() -> documentSource.extract(documentPath), options);
    }

    /**
     * Generates scenarios from an issue-tracker export.
     *
     * @throws IngestionException  if the export holds no usable issue
     * @throws GenerationException if the generation client fails
     */
    public GenerationResult fromIssueExport(JsonNode payload, GenerationOptions options) {
        log.info("Generating test scenarios from issue export");
        return generate(() -> issueExportSource.extract(payload), options);
    }

    /**
     * Generates scenarios from raw requirements text.
     *
     * @throws IngestionException  if no requirements text was given
     * @throws GenerationException if the generation client fails
     */
    public GenerationResult fromText(String text, GenerationOptions options) {
        log.info("Generating test scenarios from raw text");
        return generate(() -> textSource.extract(text), options);
    }

    /**
     * Shared path for every entry point: obtain the requirement set, generate once, enrich, assemble.
     */
    GenerationResult generate(Supplier<RequirementSet> requirementSource, GenerationOptions options) {
        GenerationOptions opts = options != null ? options : GenerationOptions.defaults();

        RequirementSet requirements = requirementSource.get();
        int numScenarios = opts.numScenarios() != null ? opts.numScenarios() : properties.defaultNumScenarios();
        DetailLevel detailLevel = resolveDetailLevel(opts.detailLevel());

        ScenarioGenerationResponse response = generationClient.generate(requirements, numScenarios, detailLevel);

        List<Scenario> scenarios = enricher.enrich(
                response.scenarios(), requirements, opts.priorityFocus(), opts.customFocus());
        log.info("Scenario generation completed: {} of {} drafts kept", scenarios.size(), response.scenarios().size());

        return assembler.assemble(scenarios, response, opts.priorityFocus(), opts.customFocus());
    }

    private DetailLevel resolveDetailLevel(String requested) {
        String value = requested != null ? requested : properties.defaultDetailLevel();
        return DetailLevel.parse(value).orElseGet(() -> {
            log.warn("Invalid detail level: {}. Using 'medium'.", value);
            return DetailLevel.MEDIUM;
        });
    }
}
