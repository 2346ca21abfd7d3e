package com.csd.leadscore.service;

import com.csd.leadscore.model.ChatIntent;
import com.csd.leadscore.model.QueryIntent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Keyword based classification of chat questions about leads.
 */
@Slf4j
@Service
public class LeadQueryParser {

    static final int DEFAULT_LIMIT = 5;

    private static final Pattern TOP_N = Pattern.compile("\\b(?:top|best|first)\\s+(\\d{1,3})\\b");
    private static final Pattern N_LEADS = Pattern.compile("\\b(\\d{1,3})\\s+(?:leads?|contacts?|prospects?)\\b");

    private static final List<String> LEAD_KEYWORDS = List.of(
            "lead", "score", "priority", "contact", "call", "email",
            "company", "companies", "customer", "prospect", "sales",
            "top", "best", "highest", "lowest", "budget", "urgent",
            "who", "which", "what", "show", "list", "tell me about",
            "recommend", "prioritize", "focus", "crm", "deal");

    public QueryIntent parse(String query) {
        String q = query == null ? "" : query.trim().toLowerCase(Locale.ROOT);
        QueryIntent.QueryIntentBuilder builder = QueryIntent.builder().rawQuery(query);

        if (!isLeadRelated(q)) {
            return builder.intent(ChatIntent.CASUAL).build();
        }

        if (q.contains("high priority") || q.contains("high-priority") || q.contains("hot lead")) {
            builder.intent(ChatIntent.HIGH_PRIORITY);
        } else if (q.contains("lowest") || q.contains("least") || q.contains("worst") || q.contains("bottom")) {
            builder.intent(ChatIntent.LOWEST).limit(extractLimit(q));
        } else if (q.contains("top") || q.contains("best") || q.contains("highest")
                || q.contains("contact first") || q.contains("prioritize")) {
            builder.intent(ChatIntent.TOP_LEADS).limit(extractLimit(q));
        } else if (q.contains("urgent") || q.contains("asap") || q.contains("deadline")) {
            builder.intent(ChatIntent.URGENT);
        } else if (q.contains("budget") || q.contains("funding")) {
            builder.intent(ChatIntent.BUDGET);
        } else if (q.contains("summary") || q.contains("overview") || q.contains("how many")
                || q.contains("count") || q.contains("breakdown")) {
            builder.intent(ChatIntent.SUMMARY);
        } else {
            builder.intent(ChatIntent.GENERAL);
        }

        QueryIntent intent = builder.build();
        log.debug("Parsed chat intent: {} (limit {})", intent.getIntent(), intent.getLimit());
        return intent;
    }

    public boolean isLeadRelated(String lowerQuery) {
        return LEAD_KEYWORDS.stream().anyMatch(lowerQuery::contains);
    }

    private int extractLimit(String q) {
        Matcher m = TOP_N.matcher(q);
        if (m.find()) {
            return Math.max(1, Integer.parseInt(m.group(1)));
        }
        m = N_LEADS.matcher(q);
        if (m.find()) {
            return Math.max(1, Integer.parseInt(m.group(1)));
        }
        return DEFAULT_LIMIT;
    }
}
