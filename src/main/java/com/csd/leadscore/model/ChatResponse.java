package com.csd.leadscore.model;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;

@Data
@Builder
public class ChatResponse {
    private String answer;
    private ChatIntent intent;
    private boolean success;
    private String error;
    private int leadsAnalyzed;
    private LocalDateTime timestamp;
}
