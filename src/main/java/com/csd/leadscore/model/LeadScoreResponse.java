package com.csd.leadscore.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LeadScoreResponse {
    private int score;
    private String justification;
    private String priorityLabel;
    private boolean success;
    private String error;
    private LocalDateTime timestamp;

    public static LeadScoreResponse from(ScoredLead lead) {
        return LeadScoreResponse.builder()
                .score(lead.getScore())
                .justification(lead.getJustification())
                .priorityLabel(lead.getPriorityLabel())
                .success(true)
                .timestamp(LocalDateTime.now())
                .build();
    }

    public static LeadScoreResponse failed(String error) {
        return LeadScoreResponse.builder()
                .score(0)
                .justification("Error processing.")
                .priorityLabel(Priority.JUNK.label())
                .success(false)
                .error(error)
                .timestamp(LocalDateTime.now())
                .build();
    }
}
