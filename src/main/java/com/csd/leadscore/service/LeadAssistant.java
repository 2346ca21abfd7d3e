package com.csd.leadscore.service;

import com.csd.leadscore.model.LeadRecord;

import java.util.List;

/**
 * Answers free-form questions about a set of already scored leads. Output is plain text and is
 * not part of the scoring contract.
 */
public interface LeadAssistant {

    String answerQuestion(String query, List<LeadRecord> leads);

    /**
     * Short reply to a question that is not about leads.
     */
    String casualReply(String query);

    default boolean isAvailable() {
        return true;
    }
}
