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
import com.example.scenariogen.model.Requirement;
import com.example.scenariogen.model.RequirementSet;
import com.example.scenariogen.model.Scenario;
import com.example.scenariogen.model.ScenarioDraft;
import com.example.scenariogen.model.ScenarioGenerationResponse;
import com.example.scenariogen.model.TestType;
import com.example.scenariogen.service.ResultAssembler;
import com.example.scenariogen.service.ScenarioEnricher;
import com.example.scenariogen.service.TestTypeClassifier;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link ScenarioOrchestrator}.
 * <p>
 * Generation client, ingestion sources and logger are mocked; enrichment and
 * assembly run for real with a fixed clock.
 */
class ScenarioOrchestratorTest {

    private static final Instant NOW = Instant.parse("2026-10-19T10:15:30Z");

    private GenerationClient generationClient;
    private DocumentRequirementSource documentSource;
    private IssueExportRequirementSource issueExportSource;
    private TextRequirementSource textSource;
    private Logger logger;
    private ScenarioOrchestrator orchestrator;

    private final RequirementSet sevenRequirements = RequirementSet.of(IntStream.rangeClosed(1, 7)
            .mapToObj(i -> new Requirement(String.valueOf(i), "Requirement " + i, Requirement.Type.FUNCTIONAL))
            .toList());

    @BeforeEach
    void setUp() {
        generationClient = mock(GenerationClient.class);
        documentSource = mock(DocumentRequirementSource.class);
        issueExportSource = mock(IssueExportRequirementSource.class);
        textSource = mock(TextRequirementSource.class);
        logger = mock(Logger.class);

        ScenarioEnricher enricher = new ScenarioEnricher(new TestTypeClassifier(), Clock.fixed(NOW, ZoneOffset.UTC));
        orchestrator = new ScenarioOrchestrator(generationClient, documentSource, issueExportSource, textSource,
                enricher, new ResultAssembler(), ScenarioProperties.defaults(), logger);
    }

    private static ScenarioGenerationResponse response(ScenarioDraft... drafts) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("num_requested", drafts.length);
        metadata.put("model_used", "gpt-4o");
        return new ScenarioGenerationResponse(List.of(drafts), metadata, "raw completion text");
    }

    private static ScenarioDraft loginDraft() {
        return new ScenarioDraft("001-01", "Successful Login with Password and OTP",
                "Verify that a user completes **authentication** with password and OTP\n"
                        + "and that the login is recorded in the audit log.",
                "1, 2, 3, 4", "High");
    }

    // ── fromRequirements ─────────────────────────────────────────────

    @Test
    @DisplayName("OTP login requirements produce one enriched security scenario")
    void otpLoginEndToEnd() {
        when(generationClient.generate(any(), anyInt(), any())).thenReturn(response(loginDraft()));

        GenerationResult result = orchestrator.fromRequirements(sevenRequirements,
                GenerationOptions.defaults().withCustomFocus(List.of("audit")));

        assertEquals(1, result.scenarios().size());
        Scenario scenario = result.scenarios().get(0);
        assertEquals("TS-001-01", scenario.id());
        assertEquals(57.14, scenario.coverage().coveragePercentage(), 0.01);
        assertEquals(TestType.SECURITY, scenario.testType());
        assertEquals(List.of("audit"), scenario.focusAreas());
        assertEquals("Verify that a user completes authentication with password and OTP "
                + "and that the login is recorded in the audit log.", scenario.description());
        assertEquals(NOW, scenario.generationTimestamp());

        assertEquals("raw completion text", result.rawLlmResponse());
        assertEquals("gpt-4o", result.metadata().get("model_used"));
        assertNull(result.metadata().get("priority_focus"));
        assertEquals(List.of("audit"), result.metadata().get("custom_focus"));
    }

    @Test
    @DisplayName("defaults request the configured count at medium detail, calling the client once")
    void defaultsAndSingleCall() {
        when(generationClient.generate(any(), anyInt(), any())).thenReturn(response());

        orchestrator.fromRequirements(sevenRequirements, null);

        verify(generationClient, times(1)).generate(sevenRequirements, 5, DetailLevel.MEDIUM);
        verifyNoMoreInteractions(generationClient);
        verify(logger, never()).warn(anyString(), any(Object.class));
    }

    @Test
    @DisplayName("invalid detail level falls back to medium with a warning")
    void invalidDetailLevel() {
        when(generationClient.generate(any(), anyInt(), any())).thenReturn(response());

        orchestrator.fromRequirements(sevenRequirements, GenerationOptions.defaults().withDetailLevel("extreme"));

        verify(generationClient).generate(sevenRequirements, 5, DetailLevel.MEDIUM);
        verify(logger).warn(eq("Invalid detail level: {}. Using 'medium'."), eq((Object) "extreme"));
    }

    @Test
    @DisplayName("valid detail level is passed through, ignoring case")
    void validDetailLevel() {
        when(generationClient.generate(any(), anyInt(), any())).thenReturn(response());

        orchestrator.fromRequirements(sevenRequirements, new GenerationOptions(3, " HIGH ", null, null));

        verify(generationClient).generate(sevenRequirements, 3, DetailLevel.HIGH);
    }

    @Test
    @DisplayName("non-positive scenario counts are passed to the client unchanged")
    void nonPositiveCountPassedThrough() {
        when(generationClient.generate(any(), anyInt(), any())).thenReturn(response());

        orchestrator.fromRequirements(sevenRequirements, GenerationOptions.defaults().withNumScenarios(0));

        verify(generationClient).generate(sevenRequirements, 0, DetailLevel.MEDIUM);
    }

    @Test
    @DisplayName("priority focus keeps only matching scenarios in model order")
    void priorityFocus() {
        when(generationClient.generate(any(), anyInt(), any())).thenReturn(response(
                new ScenarioDraft("1", "First", "d", "1", "High"),
                new ScenarioDraft("2", "Second", "d", "2", "Low"),
                new ScenarioDraft("3", "Third", "d", "3", "high")));

        GenerationResult result = orchestrator.fromRequirements(sevenRequirements,
                GenerationOptions.defaults().withPriorityFocus("HIGH"));

        assertEquals(List.of("TS-1", "TS-3"), result.scenarios().stream().map(Scenario::id).toList());
        assertEquals("HIGH", result.metadata().get("priority_focus"));
    }

    @Test
    @DisplayName("client metadata is left untouched")
    void clientMetadataUntouched() {
        ScenarioGenerationResponse response = response(loginDraft());
        when(generationClient.generate(any(), anyInt(), any())).thenReturn(response);

        GenerationResult result = orchestrator.fromRequirements(sevenRequirements,
                GenerationOptions.defaults().withPriorityFocus("High"));

        assertFalse(response.metadata().containsKey("priority_focus"));
        assertTrue(result.metadata().containsKey("priority_focus"));
        assertEquals(response.metadata().get("num_requested"), result.metadata().get("num_requested"));
    }

    @Test
    @DisplayName("null requirement set is rejected")
    void nullRequirements() {
        assertThrows(NullPointerException.class, () -> orchestrator.fromRequirements(null, null));
        verifyNoInteractions(generationClient);
    }

    // ── Failure propagation ──────────────────────────────────────────

    @Test
    @DisplayName("generation failure propagates unchanged")
    void generationFailurePropagates() {
        GenerationException failure = new GenerationException("model unavailable");
        when(generationClient.generate(any(), anyInt(), any())).thenThrow(failure);

        GenerationException thrown = assertThrows(GenerationException.class,
                () -> orchestrator.fromRequirements(sevenRequirements, null));

        assertSame(failure, thrown);
    }

    @Test
    @DisplayName("ingestion failure propagates and the client is never called")
    void ingestionFailurePropagates() {
        Path document = Path.of("missing.pdf");
        IngestionException failure = new IngestionException("Document not found: missing.pdf");
        when(documentSource.extract(document)).thenThrow(failure);

        IngestionException thrown = assertThrows(IngestionException.class,
                () -> orchestrator.fromDocument(document, null));

        assertSame(failure, thrown);
        verifyNoInteractions(generationClient);
    }

    // ── Other entry points ───────────────────────────────────────────

    @Test
    @DisplayName("document, issue export and text entry points share the generation path")
    void entryPointsDelegate() {
        when(generationClient.generate(any(), anyInt(), any())).thenReturn(response(loginDraft()));
        Path document = Path.of("srs.pdf");
        JsonNode export = JsonNodeFactory.instance.objectNode().put("key", "PROJ-1");
        when(documentSource.extract(document)).thenReturn(sevenRequirements);
        when(issueExportSource.extract(export)).thenReturn(sevenRequirements);
        when(textSource.extract("1. Users log in")).thenReturn(sevenRequirements);

        GenerationOptions options = new GenerationOptions(2, "low", null, null);
        GenerationResult fromDocument = orchestrator.fromDocument(document, options);
        GenerationResult fromExport = orchestrator.fromIssueExport(export, options);
        GenerationResult fromText = orchestrator.fromText("1. Users log in", options);

        verify(generationClient, times(3)).generate(sevenRequirements, 2, DetailLevel.LOW);
        assertEquals(fromDocument.scenarios(), fromExport.scenarios());
        assertEquals(fromDocument.scenarios(), fromText.scenarios());
    }

    @Test
    @DisplayName("empty generation yields an empty result with metadata")
    void emptyGeneration() {
        when(generationClient.generate(any(), anyInt(), any())).thenReturn(response());

        GenerationResult result = orchestrator.fromRequirements(sevenRequirements, null);

        assertTrue(result.scenarios().isEmpty());
        assertEquals("gpt-4o", result.metadata().get("model_used"));
    }
}
