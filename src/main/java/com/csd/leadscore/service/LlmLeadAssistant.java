package com.csd.leadscore.service;

import com.csd.leadscore.exception.AssistantUnavailableException;
import com.csd.leadscore.model.LeadRecord;
import com.csd.leadscore.model.Priority;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Lead assistant backed by an OpenAI-compatible chat completions endpoint.
 *
 * The model only phrases answers over the lead data it is given; it never scores leads.
 * Any transport or parsing failure surfaces as {@link AssistantUnavailableException} so the
 * caller can fall back to {@link RuleBasedLeadAssistant}. No retries are attempted.
 */
@Service
@Slf4j
public class LlmLeadAssistant implements LeadAssistant {

    static final int TOP_CONTEXT = 10;
    static final int BOTTOM_CONTEXT = 5;

    private final WebClient client;
    private final ObjectMapper objectMapper;
    private final String apiKey;
    private final String model;
    private final boolean enabled;
    private final Duration timeout;

    public LlmLeadAssistant(WebClient.Builder webClientBuilder,
                            ObjectMapper objectMapper,
                            @Value("${assistant.base-url:https://api.openai.com/v1}") String baseUrl,
                            @Value("${assistant.api.key:}") String apiKey,
                            @Value("${assistant.model:gpt-4o-mini}") String model,
                            @Value("${assistant.enabled:false}") boolean enabled,
                            @Value("${assistant.timeout-seconds:15}") long timeoutSeconds) {
        this.client = webClientBuilder.baseUrl(baseUrl).build();
        this.objectMapper = objectMapper;
        this.apiKey = apiKey;
        this.model = model;
        this.enabled = enabled;
        this.timeout = Duration.ofSeconds(timeoutSeconds);
    }

    @Override
    public boolean isAvailable() {
        return enabled && apiKey != null && !apiKey.isBlank();
    }

    @Override
    public String answerQuestion(String query, List<LeadRecord> leads) {
        if (!isAvailable()) {
            throw new AssistantUnavailableException("Lead assistant is not configured");
        }
        String raw = complete(buildPrompt(query, leads), 0.7, 500);
        return toPlainText(raw);
    }

    @Override
    public String casualReply(String query) {
        if (!isAvailable()) {
            throw new AssistantUnavailableException("Lead assistant is not configured");
        }
        String prompt = """
                You are a friendly AI assistant helping a sales team.
                The user just asked you a casual question that's not about their leads.

                USER QUESTION: %s

                Respond naturally and friendly, then gently remind them you're here to help with their lead data if needed.
                Keep your response brief (1-2 sentences) and friendly.
                """.formatted(query);
        return toPlainText(complete(prompt, 0.9, 150));
    }

    String buildPrompt(String query, List<LeadRecord> leads) {
        long high = leads.stream().filter(l -> l.scoreOrZero() >= Priority.HIGH.floor()).count();
        long medium = leads.stream().filter(l -> l.scoreOrZero() >= Priority.MEDIUM.floor() && l.scoreOrZero() < Priority.HIGH.floor()).count();
        long low = leads.stream().filter(l -> l.scoreOrZero() >= Priority.LOW.floor() && l.scoreOrZero() < Priority.MEDIUM.floor()).count();

        List<LeadRecord> sorted = leads.stream()
                .sorted(Comparator.comparingInt(LeadRecord::scoreOrZero).reversed())
                .collect(Collectors.toList());
        List<LeadRecord> top = sorted.stream().limit(TOP_CONTEXT).collect(Collectors.toList());
        List<LeadRecord> bottom = sorted.size() > TOP_CONTEXT
                ? sorted.subList(Math.max(TOP_CONTEXT, sorted.size() - BOTTOM_CONTEXT), sorted.size())
                : List.of();

        return """
                You are a helpful AI Sales Assistant. A sales team member is asking you about their leads.

                CONTEXT - You have analyzed %d leads:
                - %d High Priority leads (scores 80-100)
                - %d Medium Priority leads (scores 40-79)
                - %d Low Priority leads (scores 1-39)

                TOP %d HIGHEST-SCORING LEADS:%s

                LOWEST-SCORING LEADS:%s

                QUESTION: %s

                Answer as a short conversational paragraph. Do not use JSON, lists or quoted field values.
                Use only the lead data above and do not invent scores or contacts.
                """.formatted(leads.size(), high, medium, low, top.size(), describe(top, true), describe(bottom, false), query);
    }

    private String describe(List<LeadRecord> leads, boolean withReason) {
        StringBuilder sb = new StringBuilder();
        int idx = 1;
        for (LeadRecord lead : leads) {
            sb.append(String.format("%n%d. %s from %s - %s - Score: %d/100 - Email: %s",
                    idx++,
                    lead.displayName(),
                    lead.getAttributes().getOrDefault("company_name", "N/A"),
                    lead.getRole() == null ? "N/A" : lead.getRole(),
                    lead.scoreOrZero(),
                    lead.getAttributes().getOrDefault("email", "N/A")));
            if (withReason && lead.getJustification() != null && !lead.getJustification().isBlank()) {
                sb.append(String.format("%n   Why: %s", lead.getJustification()));
            }
        }
        return sb.toString();
    }

    private String complete(String prompt, double temperature, int maxTokens) {
        Map<String, Object> request = new HashMap<>();
        request.put("model", model);
        request.put("messages", List.of(Map.of("role", "user", "content", prompt)));
        request.put("temperature", temperature);
        request.put("max_tokens", maxTokens);

        String response;
        try {
            response = client.post()
                    .uri("/chat/completions")
                    .header("Authorization", "Bearer " + apiKey)
                    .bodyValue(request)
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(timeout)
                    .block();
        } catch (WebClientResponseException e) {
            if (e.getStatusCode().value() == 429) {
                throw new AssistantUnavailableException("Rate limit exceeded (429)", e);
            }
            throw new AssistantUnavailableException("Generation service returned " + e.getStatusCode().value(), e);
        } catch (RuntimeException e) {
            throw new AssistantUnavailableException("Generation service call failed: " + e.getMessage(), e);
        }

        if (response == null) {
            throw new AssistantUnavailableException("Generation service returned an empty response");
        }
        try {
            JsonNode root = objectMapper.readTree(response);
            JsonNode content = root.path("choices").path(0).path("message").path("content");
            if (content.isMissingNode() || content.asText().isBlank()) {
                throw new AssistantUnavailableException("Generation service response has no content");
            }
            return content.asText();
        } catch (com.fasterxml.jackson.core.JsonProcessingException e) {
            throw new AssistantUnavailableException("Generation service response is not JSON", e);
        }
    }

    /**
     * Models sometimes wrap the answer in a JSON object or quotes; unwrap to plain text.
     */
    String toPlainText(String answer) {
        String text = answer.strip();
        if (text.startsWith("```")) {
            text = text.replaceAll("^```[a-zA-Z]*\\s*", "").replaceAll("\\s*```$", "").strip();
        }
        if (text.startsWith("{") && text.endsWith("}")) {
            try {
                JsonNode node = objectMapper.readTree(text);
                for (String field : List.of("answer", "summary", "response", "message")) {
                    if (node.hasNonNull(field)) {
                        text = node.get(field).asText();
                        break;
                    }
                }
            } catch (com.fasterxml.jackson.core.JsonProcessingException e) {
                log.debug("Answer looked like JSON but did not parse, keeping raw text");
            }
        }
        return text.replaceAll("^[\"']+|[\"']+$", "").strip();
    }
}
