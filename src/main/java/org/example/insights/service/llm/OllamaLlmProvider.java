package org.example.insights.service.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * LLM provider for a local Ollama server, through its non-streaming /api/chat endpoint.
 * JSON requests use Ollama's {@code format: json} mode.
 */
public class OllamaLlmProvider implements LlmProvider {

    private static final Logger log = LoggerFactory.getLogger(OllamaLlmProvider.class);

    private static final String PROVIDER = "Ollama";

    private final WebClient webClient;
    private final String model;
    private final int timeoutSeconds;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public OllamaLlmProvider(String baseUrl, String model, int timeoutSeconds) {
        this(WebClient.builder().baseUrl(baseUrl).build(), model, timeoutSeconds);
        log.info("Ollama LLM provider initialized: baseUrl={}, model={}", baseUrl, model);
    }

    OllamaLlmProvider(WebClient webClient, String model, int timeoutSeconds) {
        this.webClient = webClient;
        this.model = model;
        this.timeoutSeconds = timeoutSeconds;
    }

    @Override
    public String generate(String systemPrompt, String userPrompt, LlmOptions options) {
        String response;
        try {
            response = webClient.post()
                    .uri("/api/chat")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(requestBody(systemPrompt, userPrompt, options))
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(Duration.ofSeconds(timeoutSeconds))
                    .block();
        } catch (RuntimeException e) {
            LlmProviderException failure = LlmProviderException.fromCallFailure(PROVIDER, e);
            log.error("Ollama call with model {} failed (transient={}): {}", model, failure.isTransient(), e.getMessage());
            throw failure;
        }
        return content(response);
    }

    Map<String, Object> requestBody(String systemPrompt, String userPrompt, LlmOptions options) {
        List<Map<String, String>> messages = new ArrayList<>();
        if (systemPrompt != null && !systemPrompt.isBlank()) {
            messages.add(Map.of("role", "system", "content", systemPrompt));
        }
        messages.add(Map.of("role", "user", "content", userPrompt));

        Map<String, Object> ollamaOptions = new HashMap<>();
        ollamaOptions.put("temperature", options.temperature());
        if (options.topP() != null) {
            ollamaOptions.put("top_p", options.topP());
        }
        if (options.maxTokens() != null) {
            ollamaOptions.put("num_predict", options.maxTokens());
        }

        Map<String, Object> body = new HashMap<>();
        body.put("model", model);
        body.put("messages", messages);
        body.put("stream", false);
        body.put("options", ollamaOptions);
        if (options.jsonOutput()) {
            body.put("format", "json");
        }
        return body;
    }

    private String content(String response) {
        JsonNode root;
        try {
            root = objectMapper.readTree(response == null ? "" : response);
        } catch (Exception e) {
            throw new LlmProviderException("Unparseable Ollama response", e);
        }
        if (root == null || root.isMissingNode()) {
            throw new LlmProviderException("Empty Ollama response");
        }
        if (root.hasNonNull("error")) {
            throw new LlmProviderException("Ollama error: " + root.get("error").asText());
        }
        JsonNode content = root.path("message").path("content");
        if (!content.isTextual()) {
            throw new LlmProviderException("Ollama response has no message content");
        }
        if ("length".equals(root.path("done_reason").asText())) {
            log.warn("Ollama reply from {} hit the token limit and may be truncated", model);
        }
        return content.asText();
    }

    @Override
    public String getModelName() {
        return model;
    }
}
