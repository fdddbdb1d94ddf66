package org.example.insights.service.llm;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;

import java.net.ConnectException;
import java.net.URI;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OllamaLlmProviderTest {

    @Test
    void requestBody_jsonOutput_usesJsonFormatAndTokenLimit() {
        OllamaLlmProvider provider = provider(respond(HttpStatus.OK, "{}"));

        Map<String, Object> body = provider.requestBody("system", "user", LlmOptions.json(0.3, 0.9, 2500));

        assertEquals("json", body.get("format"));
        assertEquals(false, body.get("stream"));
        assertEquals(Map.of("temperature", 0.3, "top_p", 0.9, "num_predict", 2500), body.get("options"));
    }

    @Test
    void generate_chatReply_returnsMessageContent() {
        OllamaLlmProvider provider = provider(respond(HttpStatus.OK, """
                {"model":"llama3.1","message":{"role":"assistant","content":"[]"},"done":true,"done_reason":"stop"}
                """));

        assertEquals("[]", provider.generate("s", "u", LlmOptions.json(0.3, 0.9, 2500)));
    }

    @Test
    void generate_errorPayload_isPermanentFailure() {
        OllamaLlmProvider provider = provider(respond(HttpStatus.OK, "{\"error\":\"model 'llama9' not found\"}"));

        LlmProviderException error = assertThrows(LlmProviderException.class,
                () -> provider.generate("s", "u", LlmOptions.full(0.5, 0.9, 120)));

        assertTrue(error.getMessage().contains("not found"));
        assertFalse(error.isTransient());
    }

    @Test
    void generate_serverUnavailable_isTransient() {
        OllamaLlmProvider provider = provider(respond(HttpStatus.SERVICE_UNAVAILABLE, "{\"error\":\"loading model\"}"));

        LlmProviderException error = assertThrows(LlmProviderException.class,
                () -> provider.generate("s", "u", LlmOptions.full(0.5, 0.9, 120)));

        assertTrue(error.isTransient());
    }

    @Test
    void generate_connectionRefused_isTransient() {
        OllamaLlmProvider provider = provider(request -> Mono.error(new WebClientRequestException(
                new ConnectException("Connection refused"), HttpMethod.POST,
                URI.create("http://localhost:11434/api/chat"), new HttpHeaders())));

        LlmProviderException error = assertThrows(LlmProviderException.class,
                () -> provider.generate("s", "u", LlmOptions.full(0.5, 0.9, 120)));

        assertTrue(error.isTransient());
    }

    private static ExchangeFunction respond(HttpStatus status, String json) {
        return request -> Mono.just(ClientResponse.create(status)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body(json)
                .build());
    }

    private static OllamaLlmProvider provider(ExchangeFunction exchange) {
        return new OllamaLlmProvider(WebClient.builder().exchangeFunction(exchange).build(), "llama3.1", 5);
    }
}
