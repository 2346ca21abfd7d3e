package com.csd.leadscore.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One lead row as it travels through import, export and chat: the raw fields, any extra
 * columns from the source file, and the scoring outcome.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LeadRecord {
    private String role;
    @JsonAlias("company_size")
    private String companySize;
    private String message;
    private Integer score;
    @JsonAlias("priority_label")
    private String priorityLabel;
    private String justification;
    private boolean success;
    private String error;
    @Builder.Default
    private Map<String, String> attributes = new LinkedHashMap<>();

    public int scoreOrZero() {
        return score == null ? 0 : score;
    }

    public String displayName() {
        String name = attributes.get("full_name");
        if (name == null || name.isBlank()) {
            name = attributes.get("name");
        }
        if (name == null || name.isBlank()) {
            return role == null || role.isBlank() ? "Unnamed lead" : role;
        }
        return name;
    }
}
