package com.csd.leadscore.service;

import com.csd.leadscore.model.ChatIntent;
import com.csd.leadscore.model.LeadInput;
import com.csd.leadscore.model.LeadRecord;
import com.csd.leadscore.model.Priority;
import com.csd.leadscore.model.QueryIntent;
import com.csd.leadscore.model.ScoredLead;
import com.csd.leadscore.model.SignalComponent;
import com.csd.leadscore.scoring.BudgetDetector;
import com.csd.leadscore.scoring.LeadScoringEngine;
import com.csd.leadscore.scoring.UrgencyDetector;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Deterministic answers for the common lead questions. Used when no generation service is
 * configured and as the fallback when one fails.
 */
@Slf4j
@Service
public class RuleBasedLeadAssistant implements LeadAssistant {

    static final String NO_LEADS = "No lead data available yet. Please process some leads first!";
    static final String CASUAL = "I'm doing well, thank you! Is there anything about your leads I can help you with?";

    private final LeadQueryParser queryParser;
    private final LeadScoringEngine engine;

    public RuleBasedLeadAssistant(LeadQueryParser queryParser, LeadScoringEngine engine) {
        this.queryParser = queryParser;
        this.engine = engine;
    }

    @Override
    public String answerQuestion(String query, List<LeadRecord> leads) {
        QueryIntent intent = queryParser.parse(query);
        return answer(intent, leads);
    }

    @Override
    public String casualReply(String query) {
        return CASUAL;
    }

    public String answer(QueryIntent intent, List<LeadRecord> leads) {
        log.debug("Rule-based answer for intent {} over {} leads", intent.getIntent(), leads.size());
        if (intent.getIntent() == ChatIntent.CASUAL) {
            return CASUAL;
        }
        if (leads.isEmpty()) {
            return NO_LEADS;
        }
        return switch (intent.getIntent()) {
            case TOP_LEADS -> formatList("Your top %d leads by score:",
                    ranked(leads).stream().limit(intent.getLimit()).collect(Collectors.toList()));
            case LOWEST -> formatList("The %d lowest scoring leads:", leads.stream()
                    .sorted(Comparator.comparingInt(LeadRecord::scoreOrZero))
                    .limit(intent.getLimit())
                    .collect(Collectors.toList()));
            case HIGH_PRIORITY -> orElse(filter(leads, l -> l.scoreOrZero() >= Priority.HIGH.floor()),
                    "You have %d high priority leads:",
                    "There are no high priority leads (score 80 or above) yet.");
            case URGENT -> orElse(filter(leads, l -> hasFlag(l, SignalComponent.URGENCY, UrgencyDetector.FLAG_URGENT)),
                    "%d leads show urgent needs:",
                    "None of your leads mention urgent needs.");
            case BUDGET -> orElse(filter(leads, l -> hasFlag(l, SignalComponent.BUDGET, BudgetDetector.FLAG_BUDGET)),
                    "%d leads mention budget:",
                    "None of your leads mention an approved or allocated budget.");
            default -> summary(leads);
        };
    }

    private String orElse(List<LeadRecord> matches, String title, String emptyAnswer) {
        return matches.isEmpty() ? emptyAnswer : formatList(title, matches);
    }

    public String summary(List<LeadRecord> leads) {
        long high = leads.stream().filter(l -> l.scoreOrZero() >= Priority.HIGH.floor()).count();
        long medium = leads.stream().filter(l -> l.scoreOrZero() >= Priority.MEDIUM.floor() && l.scoreOrZero() < Priority.HIGH.floor()).count();
        long low = leads.stream().filter(l -> l.scoreOrZero() >= Priority.LOW.floor() && l.scoreOrZero() < Priority.MEDIUM.floor()).count();
        long junk = leads.size() - high - medium - low;
        double average = leads.stream().mapToInt(LeadRecord::scoreOrZero).average().orElse(0);

        StringBuilder sb = new StringBuilder();
        sb.append(String.format("You have %d leads with an average score of %.1f: ", leads.size(), average));
        sb.append(String.format("%d high, %d medium, %d low priority and %d junk.", high, medium, low, junk));
        ranked(leads).stream().findFirst().ifPresent(best ->
                sb.append(String.format(" Your strongest lead is %s (%d/100).", describe(best), best.scoreOrZero())));
        return sb.toString();
    }

    private boolean hasFlag(LeadRecord lead, SignalComponent component, String flag) {
        ScoredLead scored = engine.score(LeadInput.of(lead.getRole(), lead.getCompanySize(), lead.getMessage()));
        return scored.signal(component).map(s -> s.flag(flag)).orElse(false);
    }

    private List<LeadRecord> ranked(List<LeadRecord> leads) {
        return leads.stream()
                .sorted(Comparator.comparingInt(LeadRecord::scoreOrZero).reversed())
                .collect(Collectors.toList());
    }

    private List<LeadRecord> filter(List<LeadRecord> leads, Predicate<LeadRecord> predicate) {
        return ranked(leads).stream().filter(predicate).collect(Collectors.toList());
    }

    private String formatList(String title, List<LeadRecord> leads) {
        StringBuilder sb = new StringBuilder(String.format(title, leads.size()));
        int idx = 1;
        for (LeadRecord lead : leads) {
            sb.append(String.format("%n%d. %s - %d/100", idx++, describe(lead), lead.scoreOrZero()));
            if (lead.getJustification() != null && !lead.getJustification().isBlank()) {
                sb.append(" (").append(lead.getJustification()).append(")");
            }
            String email = lead.getAttributes().get("email");
            if (email != null && !email.isBlank()) {
                sb.append(" - ").append(email);
            }
        }
        return sb.toString();
    }

    private String describe(LeadRecord lead) {
        StringBuilder sb = new StringBuilder(lead.displayName());
        if (lead.getRole() != null && !lead.getRole().isBlank() && !lead.getRole().equals(lead.displayName())) {
            sb.append(", ").append(lead.getRole());
        }
        String company = lead.getAttributes().get("company_name");
        if (company != null && !company.isBlank()) {
            sb.append(" at ").append(company);
        }
        return sb.toString();
    }
}
