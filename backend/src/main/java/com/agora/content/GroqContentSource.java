package com.agora.content;

import com.agora.exception.TransientContentException;
import com.agora.model.HistoryEntry;
import com.agora.model.HistoryRole;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Chat completion against Groq's OpenAI-compatible endpoint for a single model.
 * Blocks the calling (engine) thread up to the request timeout.
 */
@Slf4j
public class GroqContentSource implements ContentSource {

    private static final String COMPLETIONS_PATH = "/openai/v1/chat/completions";

    private final WebClient groqClient;
    private final String model;
    private final double temperature;
    private final int maxTokens;
    private final Duration timeout;

    public GroqContentSource(WebClient groqClient, String model, double temperature, int maxTokens, Duration timeout) {
        this.groqClient = groqClient;
        this.model = model;
        this.temperature = temperature;
        this.maxTokens = maxTokens;
        this.timeout = timeout;
    }

    @Override
    public String generate(ContentRequest request) {
        Map<String, Object> body = new HashMap<>();
        body.put("model", model);
        body.put("temperature", temperature);
        body.put("max_tokens", maxTokens);
        body.put("messages", toMessages(request));

        JsonNode response;
        try {
            response = groqClient.post()
                    .uri(COMPLETIONS_PATH)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .block(timeout);
        } catch (WebClientResponseException e) {
            throw new TransientContentException(
                    model + " returned HTTP " + e.getStatusCode().value() + ": " + e.getResponseBodyAsString(), e);
        } catch (RuntimeException e) {
            throw new TransientContentException(model + " request failed: " + e.getMessage(), e);
        }

        String content = response == null ? null
                : response.path("choices").path(0).path("message").path("content").asText(null);
        if (content == null || content.isBlank()) {
            throw new TransientContentException(model + " returned no content");
        }
        log.debug("{} produced {} chars for {}", model, content.length(), request.getPersona().getName());
        return content;
    }

    @Override
    public String name() {
        return model;
    }

    List<Map<String, String>> toMessages(ContentRequest request) {
        List<Map<String, String>> messages = new ArrayList<>();
        messages.add(Map.of("role", "system", "content", request.getSystemPrompt()));
        for (HistoryEntry entry : request.getHistory()) {
            String role = entry.getRole() == HistoryRole.SELF ? "assistant" : "user";
            messages.add(Map.of("role", role, "content", entry.getText()));
        }
        messages.add(Map.of("role", "user", "content", request.getInstruction()));
        return messages;
    }
}
