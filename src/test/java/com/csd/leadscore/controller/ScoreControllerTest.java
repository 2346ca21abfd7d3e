package com.csd.leadscore.controller;

import com.csd.leadscore.exception.GlobalExceptionHandler;
import com.csd.leadscore.scoring.LeadScoringEngine;
import com.csd.leadscore.scoring.PatternCatalog;
import com.csd.leadscore.scoring.PatternCatalogLoader;
import com.csd.leadscore.service.LeadScoringService;
import com.csd.leadscore.service.LlmLeadAssistant;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

public class ScoreControllerTest {

    private ExecutorService executor;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        PatternCatalog catalog = PatternCatalogLoader.loadDefault();
        executor = Executors.newFixedThreadPool(4);
        LeadScoringService service = new LeadScoringService(new LeadScoringEngine(catalog), executor);
        LlmLeadAssistant assistant = new LlmLeadAssistant(WebClient.builder(), new ObjectMapper(),
                "http://localhost", "", "test", false, 1);
        mockMvc = MockMvcBuilders.standaloneSetup(new ScoreController(service, catalog, assistant))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void scoresHotLead() throws Exception {
        mockMvc.perform(post("/api/score")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"role\":\"CTO\",\"companySize\":\"1000+\","
                                + "\"message\":\"Urgent migration needed, budget approved, 500+ users\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.score").value(100))
                .andExpect(jsonPath("$.priorityLabel").value("High Priority"))
                .andExpect(jsonPath("$.success").value(true));
    }

    @Test
    void explainIncludesBreakdown() throws Exception {
        mockMvc.perform(post("/api/score/explain")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"role\":\"Engineer\",\"companySize\":\"N/A\",\"message\":\"\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.score").value(25))
                .andExpect(jsonPath("$.breakdown.base").value(20))
                .andExpect(jsonPath("$.breakdown.role").value(5))
                .andExpect(jsonPath("$.priority").value("Low Priority"));
    }

    @Test
    void missingFieldIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/score")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"role\":\"CTO\",\"companySize\":\"1000+\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Bad Request"));
    }

    @Test
    void malformedBodyIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/score")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Malformed request body"));
    }

    @Test
    void batchKeepsOrder() throws Exception {
        mockMvc.perform(post("/api/score/batch")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"leads\":["
                                + "{\"role\":\"Student\",\"companySize\":\"1-10\",\"message\":\"free homework help\"},"
                                + "{\"role\":\"CEO\",\"companySize\":\"1000+\",\"message\":\"Critical deadline, $100k approved\"}]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total").value(2))
                .andExpect(jsonPath("$.successful").value(2))
                .andExpect(jsonPath("$.results[0].score").value(0))
                .andExpect(jsonPath("$.results[1].priorityLabel").value("High Priority"));
    }

    @Test
    void acceptsSnakeCaseCompanySize() throws Exception {
        mockMvc.perform(post("/api/score")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"role\":\"Engineer\",\"company_size\":\"1000+\",\"message\":\"\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.score").value(38));
    }

    @Test
    void wrongMethodIsMethodNotAllowed() throws Exception {
        mockMvc.perform(get("/api/score"))
                .andExpect(status().isMethodNotAllowed())
                .andExpect(jsonPath("$.error").value("Method Not Allowed"));
    }

    @Test
    void wrongContentTypeIsUnsupportedMediaType() throws Exception {
        mockMvc.perform(post("/api/score")
                        .contentType(MediaType.TEXT_PLAIN)
                        .content("role=CTO"))
                .andExpect(status().isUnsupportedMediaType())
                .andExpect(jsonPath("$.error").value("Unsupported Media Type"));
    }

    @Test
    void unknownPathIsNotFound() throws Exception {
        mockMvc.perform(get("/api/nothing-here"))
                .andExpect(status().isNotFound());
    }

    @Test
    void healthAndCatalog() throws Exception {
        mockMvc.perform(get("/api/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("healthy"))
                .andExpect(jsonPath("$.assistantEnabled").value(false));

        mockMvc.perform(get("/api/catalog"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.baseScore").value(20));
    }
}
