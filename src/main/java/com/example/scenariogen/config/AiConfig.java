package com.example.scenariogen.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * LLM client and shared infrastructure beans.
 * <p>
 * The active {@link ChatModel} (OpenAI or Anthropic) is chosen by {@code spring.ai.model.chat}.
 */
@Configuration
public class AiConfig {

    /**
     * ChatClient used to generate test scenarios.
     */
    @Bean("scenarioChatClient")
    public ChatClient scenarioChatClient(ChatModel chatModel) {
        return ChatClient.builder(chatModel).build();
    }

    /**
     * ObjectMapper for result artifacts and issue exports.
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    /**
     * UTC clock for generation timestamps.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
