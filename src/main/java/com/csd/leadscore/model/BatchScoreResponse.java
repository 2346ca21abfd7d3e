package com.csd.leadscore.model;

import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class BatchScoreResponse {
    private List<LeadScoreResponse> results;
    private int total;
    private int successful;
    private int failed;
}
