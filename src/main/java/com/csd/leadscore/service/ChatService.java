package com.csd.leadscore.service;

import com.csd.leadscore.exception.AssistantUnavailableException;
import com.csd.leadscore.model.ChatIntent;
import com.csd.leadscore.model.ChatResponse;
import com.csd.leadscore.model.LeadRecord;
import com.csd.leadscore.model.Priority;
import com.csd.leadscore.model.QueryIntent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Routes chat questions about scored leads to the generation service when it is configured,
 * falling back to deterministic answers otherwise.
 */
@Slf4j
@Service
public class ChatService {

    static final int MAX_SUGGESTIONS = 8;

    private final LeadQueryParser queryParser;
    private final LeadAssistant assistant;
    private final RuleBasedLeadAssistant ruleBasedAssistant;

    public ChatService(LeadQueryParser queryParser,
                       @Qualifier("llmLeadAssistant") LeadAssistant assistant,
                       RuleBasedLeadAssistant ruleBasedAssistant) {
        this.queryParser = queryParser;
        this.assistant = assistant;
        this.ruleBasedAssistant = ruleBasedAssistant;
    }

    public ChatResponse chat(String query, List<LeadRecord> leads) {
        List<LeadRecord> data = leads == null ? List.of() : leads;
        QueryIntent intent = queryParser.parse(query);
        log.info("Chat query '{}' -> {} over {} leads", query, intent.getIntent(), data.size());

        if (intent.getIntent() == ChatIntent.CASUAL) {
            return response(casual(query), intent, 0);
        }
        if (data.isEmpty()) {
            return response(RuleBasedLeadAssistant.NO_LEADS, intent, 0);
        }

        String answer;
        if (assistant.isAvailable()) {
            try {
                answer = assistant.answerQuestion(query, data);
            } catch (AssistantUnavailableException e) {
                log.warn("Generation service failed, using rule-based answer: {}", e.getMessage());
                answer = ruleBasedAssistant.answer(intent, data);
            }
        } else {
            answer = ruleBasedAssistant.answer(intent, data);
        }
        return response(answer, intent, data.size());
    }

    private String casual(String query) {
        if (assistant.isAvailable()) {
            try {
                return assistant.casualReply(query);
            } catch (AssistantUnavailableException e) {
                log.warn("Generation service failed on casual chat: {}", e.getMessage());
            }
        }
        return ruleBasedAssistant.casualReply(query);
    }

    public List<String> suggestions(List<LeadRecord> leads) {
        if (leads == null || leads.isEmpty()) {
            return List.of("How do I get started?", "What can you help me with?");
        }
        long high = leads.stream().filter(l -> l.scoreOrZero() >= Priority.HIGH.floor()).count();

        List<String> suggestions = new ArrayList<>(List.of(
                "Who are the top 5 leads I should contact?",
                "Show me all high priority leads",
                "What patterns do you see in high-scoring leads?",
                "Which companies have urgent needs?",
                "Who has budget approval?",
                "What industries are represented in top leads?",
                "Compare high vs medium priority leads",
                "Give me contact details for top 3 leads"));
        if (high > 0) {
            suggestions.add(0, "Tell me about the " + high + " high priority leads");
        }
        return suggestions.subList(0, Math.min(MAX_SUGGESTIONS, suggestions.size()));
    }

    private ChatResponse response(String answer, QueryIntent intent, int leadsAnalyzed) {
        return ChatResponse.builder()
                .answer(answer)
                .intent(intent.getIntent())
                .success(true)
                .leadsAnalyzed(leadsAnalyzed)
                .timestamp(LocalDateTime.now())
                .build();
    }
}
