package com.example.scenariogen.agent;

import com.example.scenariogen.config.ScenarioProperties;
import com.example.scenariogen.model.DetailLevel;
import com.example.scenariogen.model.LlmCompletion;
import com.example.scenariogen.model.RequirementSet;
import com.example.scenariogen.model.ScenarioDraft;
import com.example.scenariogen.model.ScenarioGenerationResponse;
import com.example.scenariogen.service.ResilientLlmCaller;
import com.example.scenariogen.service.ScenarioResponseParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link GenerationClient} backed by a Spring AI {@link ChatClient}.
 * <p>
 * Sends one prompt per call, parses the completion into drafts and reports
 * model id, timing, token usage and counts as metadata.
 */
@Service
public class ScenarioGenerationAgent implements GenerationClient {

    private static final Logger log = LoggerFactory.getLogger(ScenarioGenerationAgent.class);

    private final ChatClient chatClient;
    private final ScenarioPromptBuilder promptBuilder;
    private final ScenarioResponseParser responseParser;
    private final ScenarioProperties properties;

    public ScenarioGenerationAgent(@Qualifier("scenarioChatClient") ChatClient chatClient,
                                   ScenarioPromptBuilder promptBuilder,
                                   ScenarioResponseParser responseParser,
                                   ScenarioProperties properties) {
        this.chatClient = chatClient;
        this.promptBuilder = promptBuilder;
        this.responseParser = responseParser;
        this.properties = properties;
    }

    @Override
    public ScenarioGenerationResponse generate(RequirementSet requirements, int numScenarios,
                                               DetailLevel detailLevel) {
        log.info("ScenarioGenerationAgent: requesting {} scenarios ({} detail, {} requirements)",
                numScenarios, detailLevel.label(), requirements.totalRequirements());

        LlmCompletion completion = ResilientLlmCaller.callText(
                chatClient,
                promptBuilder.systemPrompt(),
                promptBuilder.userPrompt(requirements, numScenarios, detailLevel),
                properties.llm(),
                "ScenarioGenerationAgent");

        List<ScenarioDraft> drafts = responseParser.parse(completion.text());
        if (drafts.isEmpty()) {
            log.warn("ScenarioGenerationAgent: no scenarios could be parsed from the completion");
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("num_requested", numScenarios);
        metadata.put("num_generated", drafts.size());
        metadata.put("detail_level", detailLevel.label());
        metadata.put("requirements_source", requirements.source());
        metadata.put("model_used", completion.model());
        metadata.put("elapsed_time", completion.elapsedSeconds());
        metadata.put("input_tokens", completion.inputTokens());
        metadata.put("output_tokens", completion.outputTokens());

        log.info("ScenarioGenerationAgent: {} drafts generated", drafts.size());
        return new ScenarioGenerationResponse(drafts, metadata, completion.text());
    }
}
