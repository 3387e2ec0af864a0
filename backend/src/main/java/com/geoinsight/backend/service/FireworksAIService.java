package com.geoinsight.backend.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.geoinsight.backend.exception.ProviderException;
import com.geoinsight.backend.model.ReportFacts;
import com.geoinsight.backend.provider.ReportSummarizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Report summaries from a Fireworks AI chat model.
 */
@Service
public class FireworksAIService implements ReportSummarizer {

    private static final Logger log = LoggerFactory.getLogger(FireworksAIService.class);

    private static final String PROVIDER = "fireworks";

    private static final String SYSTEM_PROMPT = "You are a real estate analyst. Summarize the location report "
            + "for a prospective buyer in at most five sentences. Mention walkability, greenery and returns "
            + "where available. If sections are listed as missing, say that they could not be assessed. "
            + "Never invent figures.";

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    @Value("${fireworks.api.url:https://api.fireworks.ai/inference/v1/chat/completions}")
    private String apiUrl;

    @Value("${fireworks.api.key:}")
    private String apiKey;

    @Value("${fireworks.api.model:accounts/fireworks/models/llama-v3p1-8b-instruct}")
    private String model;

    public FireworksAIService(ObjectMapper objectMapper) {
        this.httpClient = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build();
        this.objectMapper = objectMapper;
    }

    @Override
    public String summarize(ReportFacts facts) {
        String factsJson;
        try {
            factsJson = objectMapper.writeValueAsString(facts);
        } catch (JsonProcessingException e) {
            throw new ProviderException(PROVIDER, "Could not serialize report facts", e);
        }
        List<Map<String, String>> messages = List.of(
                Map.of("role", "system", "content", SYSTEM_PROMPT),
                Map.of("role", "user", "content", "Location report:\n" + factsJson));
        return chatCompletion(messages, 400, 0.3);
    }

    /**
     * Send a chat completion request with custom parameters.
     */
    public String chatCompletion(List<Map<String, String>> messages, int maxTokens, double temperature) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new ProviderException(PROVIDER, "API key not configured (fireworks.api.key)");
        }

        try {
            Map<String, Object> requestBody = Map.of(
                    "model", model,
                    "max_tokens", maxTokens,
                    "top_p", 1,
                    "temperature", temperature,
                    "messages", messages);

            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(apiUrl))
                    .timeout(Duration.ofSeconds(60))
                    .header("Accept", "application/json")
                    .header("Content-Type", "application/json")
                    .header("Authorization", "Bearer " + apiKey)
                    .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(requestBody)))
                    .build();

            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

            if (response.statusCode() != 200) {
                log.error("Fireworks AI API error: {} - {}", response.statusCode(), response.body());
                throw new ProviderException(PROVIDER, "HTTP " + response.statusCode());
            }

            JsonNode responseJson = objectMapper.readTree(response.body());
            String content = responseJson
                    .path("choices")
                    .path(0)
                    .path("message")
                    .path("content")
                    .asText();
            if (content.isBlank()) {
                throw new ProviderException(PROVIDER, "Empty completion");
            }
            return content.trim();
        } catch (IOException e) {
            throw new ProviderException(PROVIDER, "Request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderException(PROVIDER, "Interrupted", e);
        }
    }
}
