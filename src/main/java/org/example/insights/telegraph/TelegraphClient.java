package org.example.insights.telegraph;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.example.insights.config.TelegraphProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

@Component
public class TelegraphClient implements TelegraphApi {

    private static final Logger log = LoggerFactory.getLogger(TelegraphClient.class);

    private final WebClient webClient;
    private final int timeoutSeconds;
    private final ObjectMapper objectMapper;

    public TelegraphClient(TelegraphProperties properties, ObjectMapper objectMapper) {
        this.webClient = WebClient.builder()
                .baseUrl(properties.getApiUrl())
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(2 * 1024 * 1024))
                .build();
        this.timeoutSeconds = properties.getTimeoutSeconds();
        this.objectMapper = objectMapper;
    }

    @Override
    public TelegraphPage createPage(String accessToken, String title, String authorName, JsonNode content) {
        Map<String, Object> body = requestBody(accessToken, title, authorName, content);
        return post("/createPage", body);
    }

    @Override
    public TelegraphPage editPage(String accessToken, String path, String title, String authorName, JsonNode content) {
        if (path == null || path.isBlank()) {
            throw new TelegraphApiException("Page path is required for editPage");
        }
        Map<String, Object> body = requestBody(accessToken, title, authorName, content);
        return post("/editPage/" + path, body);
    }

    private Map<String, Object> requestBody(String accessToken, String title, String authorName, JsonNode content) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("access_token", accessToken);
        body.put("title", title);
        if (authorName != null && !authorName.isBlank()) {
            body.put("author_name", authorName);
        }
        body.put("content", content);
        body.put("return_content", false);
        return body;
    }

    private TelegraphPage post(String uri, Map<String, Object> body) {
        String response;
        try {
            response = webClient.post()
                    .uri(uri)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(Duration.ofSeconds(timeoutSeconds))
                    .block();
        } catch (WebClientResponseException e) {
            log.error("Telegraph API error on {}: {} - {}", uri, e.getStatusCode(), e.getResponseBodyAsString());
            throw new TelegraphApiException("Telegraph API error: " + e.getStatusCode(), e);
        } catch (Exception e) {
            throw new TelegraphApiException("Telegraph request to " + uri + " failed: " + e.getMessage(), e);
        }

        try {
            JsonNode root = objectMapper.readTree(response);
            if (root == null || !root.path("ok").asBoolean(false)) {
                String error = root == null ? "empty response" : root.path("error").asText("unknown error");
                throw new TelegraphApiException("Telegraph rejected " + uri + ": " + error);
            }
            return objectMapper.treeToValue(root.get("result"), TelegraphPage.class);
        } catch (TelegraphApiException e) {
            throw e;
        } catch (Exception e) {
            throw new TelegraphApiException("Invalid Telegraph response for " + uri, e);
        }
    }
}
