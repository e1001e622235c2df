package com.marketpulse.service.assistant;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Chat completions over HTTP against an OpenAI-compatible endpoint
 * (POST {api-url}/chat/completions, bearer token).
 */
@Slf4j
public class HostedLlmClient implements LlmClient {

    private final WebClient webClient;
    private final String model;
    private final double temperature;
    private final Duration timeout;

    public HostedLlmClient(WebClient.Builder builder, String apiUrl, String apiKey,
                           String model, double temperature, Duration timeout) {
        this.webClient = builder
            .baseUrl(apiUrl)
            .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey)
            .build();
        this.model = model;
        this.temperature = temperature;
        this.timeout = timeout;
    }

    @Override
    public String complete(List<LlmMessage> messages) {
        log.debug("Requesting completion from {} ({} messages)", model, messages.size());
        JsonNode response;
        try {
            response = webClient.post()
                .uri("/chat/completions")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(requestBody(messages))
                .retrieve()
                .bodyToMono(JsonNode.class)
                .block(timeout);
        } catch (WebClientResponseException e) {
            throw new LlmException("HTTP " + e.getStatusCode().value() + " from model endpoint", e);
        } catch (WebClientException e) {
            throw new LlmException("Model endpoint unreachable: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            // block(timeout) expiry or an undecodable body
            throw new LlmException("Model call failed: " + e.getMessage(), e);
        }
        return extractContent(response);
    }

    @Override
    public String modelId() {
        return model;
    }

    Map<String, Object> requestBody(List<LlmMessage> messages) {
        List<Map<String, String>> turns = new ArrayList<>();
        for (LlmMessage m : messages) {
            turns.add(Map.of("role", m.getRole(), "content", m.getContent()));
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", model);
        body.put("temperature", temperature);
        body.put("messages", turns);
        return body;
    }

    static String extractContent(JsonNode response) {
        if (response == null) {
            throw new LlmException("Empty response from model endpoint");
        }
        JsonNode content = response.path("choices").path(0).path("message").path("content");
        if (!content.isTextual()) {
            throw new LlmException("Response missing choices[0].message.content");
        }
        return content.asText();
    }
}
