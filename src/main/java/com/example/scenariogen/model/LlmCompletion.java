package com.example.scenariogen.model;

/**
 * Text completion plus the usage figures reported by the provider.
 *
 * @param text           Completion text
 * @param model          Model id reported by the provider, or "unknown"
 * @param inputTokens    Prompt tokens, -1 when not reported
 * @param outputTokens   Completion tokens, -1 when not reported
 * @param elapsedSeconds Wall-clock time of the successful attempt
 */
public record LlmCompletion(
        String text,
        String model,
        long inputTokens,
        long outputTokens,
        double elapsedSeconds
) {}
