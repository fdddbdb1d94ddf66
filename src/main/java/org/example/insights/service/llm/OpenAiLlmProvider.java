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
 * LLM provider for OpenAI and OpenAI-compatible APIs.
 * Calls the /chat/completions endpoint under the configured base URL; JSON requests set
 * {@code response_format: json_object}.
 */
public class OpenAiLlmProvider implements LlmProvider {

    private static final Logger log = LoggerFactory.getLogger(OpenAiLlmProvider.class);

    private static final String PROVIDER = "OpenAI";

    private final WebClient webClient;
    private final String model;
    private final int timeoutSeconds;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public OpenAiLlmProvider(String baseUrl, String apiKey, String model, int timeoutSeconds) {
        this(WebClient.builder()
                        .baseUrl(baseUrl)
                        .defaultHeader("Authorization", "Bearer " + apiKey)
                        .build(),
                model,
                timeoutSeconds);
        log.info("OpenAI LLM provider initialized: baseUrl={}, model={}", baseUrl, model);
    }

    OpenAiLlmProvider(WebClient webClient, String model, int timeoutSeconds) {
        this.webClient = webClient;
        this.model = model;
        this.timeoutSeconds = timeoutSeconds;
    }

    @Override
    public String generate(String systemPrompt, String userPrompt, LlmOptions options) {
        String response;
        try {
            response = webClient.post()
                    .uri("/chat/completions")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(requestBody(systemPrompt, userPrompt, options))
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(Duration.ofSeconds(timeoutSeconds))
                    .block();
        } catch (RuntimeException e) {
            LlmProviderException failure = LlmProviderException.fromCallFailure(PROVIDER, e);
            log.error("OpenAI call with model {} failed (transient={}): {}", model, failure.isTransient(), e.getMessage());
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

        Map<String, Object> body = new HashMap<>();
        body.put("model", model);
        body.put("messages", messages);
        body.put("temperature", options.temperature());
        if (options.topP() != null) {
            body.put("top_p", options.topP());
        }
        if (options.maxTokens() != null) {
            body.put("max_tokens", options.maxTokens());
        }
        if (options.jsonOutput()) {
            body.put("response_format", Map.of("type", "json_object"));
        }
        return body;
    }

    private String content(String response) {
        JsonNode root;
        try {
            root = objectMapper.readTree(response == null ? "" : response);
        } catch (Exception e) {
            throw new LlmProviderException("Unparseable OpenAI response", e);
        }
        JsonNode choice = root == null ? null : root.path("choices").path(0);
        if (choice == null || choice.isMissingNode()) {
            throw new LlmProviderException("Invalid response format from OpenAI API");
        }
        JsonNode message = choice.path("message");
        if (message.hasNonNull("refusal")) {
            throw new LlmProviderException("OpenAI model refused the request: " + message.get("refusal").asText());
        }
        if (!message.path("content").isTextual()) {
            throw new LlmProviderException("OpenAI response has no message content");
        }
        if ("length".equals(choice.path("finish_reason").asText())) {
            log.warn("OpenAI reply from {} hit the token limit and may be truncated", model);
        }
        return message.get("content").asText();
    }

    @Override
    public String getModelName() {
        return model;
    }
}
