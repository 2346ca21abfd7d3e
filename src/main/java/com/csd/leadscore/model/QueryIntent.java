package com.csd.leadscore.model;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class QueryIntent {
    private String rawQuery;
    private ChatIntent intent;
    private Integer limit; // "top 5" -> 5
}
