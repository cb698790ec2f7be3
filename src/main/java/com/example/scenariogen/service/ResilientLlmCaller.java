package com.example.scenariogen.service;

import com.example.scenariogen.config.ScenarioProperties;
import com.example.scenariogen.exception.GenerationException;
import com.example.scenariogen.model.LlmCompletion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.metadata.ChatResponseMetadata;
import org.springframework.ai.chat.metadata.Usage;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.ChatOptions;

/**
 * Utility for LLM text completions with bounded retry.
 * <p>
 * Each failed attempt (transport error, empty content) is retried up to
 * {@code maxRetries} times, waiting {@code attempt * retryBackoff} in between.
 * Token usage and the model id are read from the response metadata when the
 * provider reports them.
 */
public final class ResilientLlmCaller {

    private static final Logger log = LoggerFactory.getLogger(ResilientLlmCaller.class);

    private ResilientLlmCaller() {
        // utility class, not instantiable
    }

    /**
     * Calls the model and returns the raw completion text with usage figures.
     *
     * @param chatClient   the LLM client to use
     * @param systemPrompt the system prompt
     * @param userPrompt   the user prompt
     * @param settings     temperature and retry settings
     * @param callerName   caller name (for logging)
     * @return the completion
     * @throws GenerationException if all attempts fail
     */
    public static LlmCompletion callText(ChatClient chatClient, String systemPrompt, String userPrompt,
                                         ScenarioProperties.Llm settings, String callerName) {
        ChatOptions options = ChatOptions.builder()
                .temperature(settings.temperature())
                .build();
        int maxRetries = settings.maxRetries();

        Exception lastError = null;
        for (int attempt = 1; attempt <= maxRetries + 1; attempt++) {
            long started = System.nanoTime();
            try {
                ChatResponse chatResponse = chatClient.prompt()
                        .system(systemPrompt)
                        .user(userPrompt)
                        .options(options)
                        .call()
                        .chatResponse();

                String content = (chatResponse != null && chatResponse.getResult() != null
                        && chatResponse.getResult().getOutput() != null)
                        ? chatResponse.getResult().getOutput().getText()
                        : null;
                if (content == null || content.isBlank()) {
                    throw new GenerationException("Empty or null content in LLM response");
                }

                double elapsed = (System.nanoTime() - started) / 1_000_000_000.0;
                LlmCompletion completion = toCompletion(content, chatResponse.getMetadata(), elapsed);
                log.info("{}: completion received in {}s (model={}, tokens in/out={}/{})",
                        callerName, String.format("%.2f", elapsed), completion.model(),
                        completion.inputTokens(), completion.outputTokens());
                return completion;
            } catch (Exception e) {
                lastError = e;
                if (attempt <= maxRetries) {
                    long delay = attempt * settings.retryBackoff().toMillis();
                    log.warn("{}: attempt {}/{} failed ({}), retrying in {}ms...",
                            callerName, attempt, maxRetries + 1, rootCauseMessage(e), delay);
                    try {
                        Thread.sleep(delay);
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        break;
                    }
                }
            }
        }
        throw new GenerationException("Error in " + callerName + " after " + (maxRetries + 1)
                + " attempts: " + (lastError != null ? lastError.getMessage() : "interrupted"), lastError);
    }

    private static LlmCompletion toCompletion(String content, ChatResponseMetadata metadata, double elapsed) {
        String model = "unknown";
        long inputTokens = -1;
        long outputTokens = -1;
        if (metadata != null) {
            if (metadata.getModel() != null && !metadata.getModel().isBlank()) {
                model = metadata.getModel();
            }
            Usage usage = metadata.getUsage();
            if (usage != null) {
                if (usage.getPromptTokens() != null) inputTokens = usage.getPromptTokens().longValue();
                if (usage.getCompletionTokens() != null) outputTokens = usage.getCompletionTokens().longValue();
            }
        }
        return new LlmCompletion(content, model, inputTokens, outputTokens, elapsed);
    }

    private static String rootCauseMessage(Exception e) {
        Throwable cause = e;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        String msg = cause.getMessage();
        return msg != null && msg.length() > 150 ? msg.substring(0, 150) + "..." : msg;
    }
}
