package com.planguard.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Profile;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

import java.util.HashMap;
import java.util.Map;

/**
 * OllamaLLMClient — production LLMClient backed by a local Ollama server.
 *
 * RestTemplate exceptions (ResourceAccessException, HTTP 4xx/5xx) propagate
 * as thrown; only an unreadable response body is wrapped.
 */
@Component
@Profile("!mock")
public class OllamaLLMClient implements LLMClient {

    private static final Logger log = LoggerFactory.getLogger(OllamaLLMClient.class);

    private final String       baseUrl;
    private final String       model;
    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;

    @Autowired
    public OllamaLLMClient(
            @Value("${ollama.base-url:http://localhost:11434}") String baseUrl,
            @Value("${ollama.model:llama3:8b}") String model) {
        this(baseUrl, model, new RestTemplate(), new ObjectMapper());
    }

    OllamaLLMClient(String baseUrl, String model, RestTemplate restTemplate, ObjectMapper objectMapper) {
        this.baseUrl      = baseUrl;
        this.model        = model;
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public String generateWithRole(LlmRole role, String userPrompt, double temperature) {
        String fullPrompt = getSystemPromptForRole(role) + "\n\n" + userPrompt;

        log.debug("[Ollama] role={} temperature={} promptLen={}", role, temperature, fullPrompt.length());

        return callOllama(fullPrompt, temperature);
    }

    // =========================================================================
    // System prompts
    // =========================================================================

    private String getSystemPromptForRole(LlmRole role) {
        return switch (role) {
            case PLANNER -> """
                    You are a precise task planner.
                    Produce a plan as a JSON object with "goal_description", "nodes" and "edges".
                    Each node has "id", "action_type", "params" and "description".
                    Each edge has "source", "target" and "relationship".
                    The plan must be a single connected acyclic graph.
                    Output ONLY valid JSON. No prose outside the JSON object.
                    """;

            case CORRECTOR -> """
                    You are a precise plan repairer.
                    You are given a plan that failed verification, the verifier's diagnostics,
                    and every earlier failed attempt. Do not repeat an earlier mistake.
                    Output the complete corrected plan in the same JSON schema.
                    Output ONLY valid JSON. No prose outside the JSON object.
                    """;
        };
    }

    // =========================================================================
    // HTTP client
    // =========================================================================

    private String callOllama(String prompt, double temperature) {
        String url = baseUrl + "/api/generate";

        Map<String, Object> body = new HashMap<>();
        body.put("model",       model);
        body.put("prompt",      prompt);
        body.put("temperature", temperature);
        body.put("stream",      false);

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);

        ResponseEntity<String> response =
                restTemplate.postForEntity(url, new HttpEntity<>(body, headers), String.class);

        String raw = response.getBody();
        if (raw == null) {
            log.warn("[Ollama] Empty response body");
            return "";
        }

        try {
            JsonNode root = objectMapper.readTree(raw);
            String result = root.has("response") ? root.get("response").asText() : "";
            log.debug("[Ollama] responseLen={}", result.length());
            return result;
        } catch (JsonProcessingException e) {
            log.error("[Ollama] Unreadable response: {}", e.getOriginalMessage());
            throw new IllegalStateException("Ollama returned an unreadable response: " + e.getOriginalMessage(), e);
        }
    }
}
