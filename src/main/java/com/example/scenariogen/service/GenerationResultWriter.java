package com.example.scenariogen.service;

import com.example.scenariogen.config.ScenarioProperties;
import com.example.scenariogen.model.GenerationResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Writes {@link GenerationResult}s as JSON audit artifacts.
 */
@Service
public class GenerationResultWriter {

    private static final Logger log = LoggerFactory.getLogger(GenerationResultWriter.class);

    private static final DateTimeFormatter RUN_FOLDER = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final ObjectMapper objectMapper;
    private final ScenarioProperties properties;
    private final Clock clock;

    public GenerationResultWriter(ObjectMapper objectMapper, ScenarioProperties properties, Clock clock) {
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Serializes the result with top-level keys {@code scenarios}, {@code metadata}, {@code raw_llm_response}.
     */
    public String toJson(GenerationResult result) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(result);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Unable to serialize generation result: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Writes the result to {@code <output-dir>/<yyyyMMdd_HHmmss>/scenarios.json}.
     *
     * @return path of the written file
     */
    public Path write(GenerationResult result) {
        String json = toJson(result);
        try {
            Path runDir = Path.of(properties.outputDir()).resolve(LocalDateTime.now(clock).format(RUN_FOLDER));
            Files.createDirectories(runDir);
            Path file = runDir.resolve("scenarios.json");
            Files.writeString(file, json, StandardCharsets.UTF_8);
            log.info("Generation result written: {} ({} scenarios)", file, result.scenarios().size());
            return file;
        } catch (IOException e) {
            throw new UncheckedIOException("Error writing the generation result: " + e.getMessage(), e);
        }
    }
}
