package com.csd.leadscore.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class BatchScoreRequest {
    private List<LeadScoreRequest> leads;
}
