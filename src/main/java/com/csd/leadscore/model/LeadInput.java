package com.csd.leadscore.model;

import lombok.Builder;
import lombok.Value;

/**
 * Raw lead fields as submitted. Null fields are normalized to empty strings.
 */
@Value
@Builder
public class LeadInput {
    String role;
    String companySize;
    String message;

    public static LeadInput of(String role, String companySize, String message) {
        return LeadInput.builder()
                .role(role == null ? "" : role)
                .companySize(companySize == null ? "" : companySize)
                .message(message == null ? "" : message)
                .build();
    }
}
