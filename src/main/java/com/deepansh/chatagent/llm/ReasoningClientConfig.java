package com.deepansh.chatagent.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

import java.util.Locale;

/**
 * Creates the provider-specific reasoning client selected by LLM_PROVIDER.
 * ResilientReasoningClient wraps it with the circuit breaker.
 */
@Configuration
@Slf4j
public class ReasoningClientConfig {

    @Value("${llm.provider:openai}")
    private String provider;

    @Bean
    @ConfigurationProperties(prefix = "openai")
    public LlmProviderProperties openAiProperties() {
        return new LlmProviderProperties();
    }

    @Bean
    @ConfigurationProperties(prefix = "groq")
    public LlmProviderProperties groqProperties() {
        return new LlmProviderProperties();
    }

    @Bean
    @ConfigurationProperties(prefix = "gemini")
    public LlmProviderProperties geminiProperties() {
        return new LlmProviderProperties();
    }

    @Bean("providerReasoningClient")
    public ReasoningClient providerReasoningClient(
            ObjectMapper objectMapper,
            @Qualifier("openAiProperties") LlmProviderProperties openAi,
            @Qualifier("groqProperties") LlmProviderProperties groq,
            @Qualifier("geminiProperties") LlmProviderProperties gemini,
            @Qualifier("pooledRestClientBuilder") RestClient.Builder builder) {

        String name = provider.toLowerCase(Locale.ROOT);
        LlmProviderProperties active = switch (name) {
            case "groq" -> groq;
            case "gemini" -> gemini;
            default -> openAi;
        };

        log.info("================================================================");
        log.info("  Reasoning provider : {}", name.toUpperCase(Locale.ROOT));
        log.info("  Model              : {}", active.getModel());
        log.info("================================================================");
        if (active.getApiKey() == null || active.getApiKey().isBlank()) {
            log.error("  {} API key not set! Set env var: {}_API_KEY", name, name.toUpperCase(Locale.ROOT));
        }

        return new GenericReasoningClient(active, objectMapper, name, builder);
    }
}
