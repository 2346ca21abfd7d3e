package com.csd.leadscore.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LeadScoreRequest {
    @NotNull
    private String role;
    @NotNull
    @JsonAlias("company_size")
    private String companySize;
    @NotNull
    private String message;

    public LeadInput toInput() {
        return LeadInput.of(role, companySize, message);
    }
}
