package org.example.insights.config;

import org.example.insights.service.llm.LlmProvider;
import org.example.insights.service.llm.OllamaLlmProvider;
import org.example.insights.service.llm.OpenAiLlmProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for LLM providers.
 * Creates separate beans for topic summarization and condensed highlights.
 */
@Configuration
public class LlmProviderConfig {

    private static final Logger log = LoggerFactory.getLogger(LlmProviderConfig.class);

    // Global provider config
    @Value("${ai.provider:openai}")
    private String provider;

    @Value("${ai.timeout-seconds:180}")
    private int timeoutSeconds;

    @Value("${ai.openai.base-url:https://api.openai.com/v1}")
    private String openAiBaseUrl;

    @Value("${ai.openai.api-key:}")
    private String openAiApiKey;

    @Value("${ai.openai.model:gpt-4o-mini}")
    private String openAiModel;

    @Value("${ai.ollama.base-url:http://localhost:11434}")
    private String ollamaBaseUrl;

    @Value("${ai.ollama.model:llama3.1:latest}")
    private String ollamaModel;

    // Summarization provider config (defaults to global provider)
    @Value("${recap.summarization.provider:${ai.provider:openai}}")
    private String summarizationProvider;

    @Value("${recap.summarization.timeout-seconds:${ai.timeout-seconds:180}}")
    private int summarizationTimeoutSeconds;

    @Value("${recap.summarization.openai.model:${ai.openai.model:gpt-4o-mini}}")
    private String summarizationOpenAiModel;

    @Value("${recap.summarization.ollama.model:${ai.ollama.model:llama3.1:latest}}")
    private String summarizationOllamaModel;

    // Condense provider config (short one-line highlight, tighter timeout)
    @Value("${recap.condense.provider:${ai.provider:openai}}")
    private String condenseProvider;

    @Value("${recap.condense.timeout-seconds:60}")
    private int condenseTimeoutSeconds;

    @Value("${recap.condense.openai.model:${ai.openai.model:gpt-4o-mini}}")
    private String condenseOpenAiModel;

    @Value("${recap.condense.ollama.model:${ai.ollama.model:llama3.1:latest}}")
    private String condenseOllamaModel;

    @Bean
    @Qualifier("recapSummarizationLlmProvider")
    public LlmProvider recapSummarizationLlmProvider() {
        log.info("Configuring recap summarization LLM provider: {}", summarizationProvider);
        return createProvider(
                summarizationProvider,
                summarizationOllamaModel,
                summarizationOpenAiModel,
                summarizationTimeoutSeconds,
                "recap-summarization"
        );
    }

    @Bean
    @Qualifier("recapCondenseLlmProvider")
    public LlmProvider recapCondenseLlmProvider() {
        log.info("Configuring recap condense LLM provider: {}", condenseProvider);
        return createProvider(
                condenseProvider,
                condenseOllamaModel,
                condenseOpenAiModel,
                condenseTimeoutSeconds,
                "recap-condense"
        );
    }

    private LlmProvider createProvider(
            String providerType,
            String ollamaModelName,
            String openAiModelName,
            int timeout,
            String purpose) {

        return switch (providerType.toLowerCase()) {
            case "ollama" -> {
                log.info("Creating Ollama provider for {}: baseUrl={}, model={}",
                        purpose, ollamaBaseUrl, ollamaModelName);
                yield new OllamaLlmProvider(ollamaBaseUrl, ollamaModelName, timeout);
            }
            case "openai" -> {
                if (openAiApiKey == null || openAiApiKey.isBlank()) {
                    log.warn("OpenAI API key not configured for {} provider, falling back to Ollama", purpose);
                    yield new OllamaLlmProvider(ollamaBaseUrl, ollamaModelName, timeout);
                }
                log.info("Creating OpenAI provider for {}: model={}", purpose, openAiModelName);
                yield new OpenAiLlmProvider(openAiBaseUrl, openAiApiKey, openAiModelName, timeout);
            }
            default -> {
                log.warn("Unknown provider type '{}' for {}, falling back to Ollama", providerType, purpose);
                yield new OllamaLlmProvider(ollamaBaseUrl, ollamaModelName, timeout);
            }
        };
    }
}
