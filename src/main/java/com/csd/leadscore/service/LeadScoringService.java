package com.csd.leadscore.service;

import com.csd.leadscore.exception.InvalidLeadException;
import com.csd.leadscore.model.BatchScoreResponse;
import com.csd.leadscore.model.LeadInput;
import com.csd.leadscore.model.LeadRecord;
import com.csd.leadscore.model.LeadScoreRequest;
import com.csd.leadscore.model.LeadScoreResponse;
import com.csd.leadscore.model.Priority;
import com.csd.leadscore.model.ScoredLead;
import com.csd.leadscore.scoring.LeadScoringEngine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.stream.Collectors;

/**
 * Wraps the scoring engine for the HTTP layer: single scoring, batch fan-out on a bounded
 * executor, and scoring of imported rows.
 */
@Slf4j
@Service
public class LeadScoringService {

    private final LeadScoringEngine engine;
    private final ExecutorService executor;

    public LeadScoringService(LeadScoringEngine engine,
                              @Qualifier("batchScoringExecutor") ExecutorService executor) {
        this.engine = engine;
        this.executor = executor;
    }

    public ScoredLead explain(LeadScoreRequest request) {
        validate(request);
        return engine.score(request.toInput());
    }

    public LeadScoreResponse score(LeadScoreRequest request) {
        validate(request);
        ScoredLead lead = engine.score(request.toInput());
        log.info("Scored lead role='{}' size='{}' -> {} ({})",
                request.getRole(), request.getCompanySize(), lead.getScore(), lead.getPriorityLabel());
        return LeadScoreResponse.from(lead);
    }

    /**
     * Score every lead concurrently. A failing lead produces a failed entry rather than failing
     * the batch; results keep the input order.
     */
    public BatchScoreResponse scoreBatch(List<LeadScoreRequest> leads) {
        if (leads == null) {
            throw new InvalidLeadException("Batch must contain a 'leads' array");
        }
        log.info("Batch scoring {} leads", leads.size());

        List<CompletableFuture<LeadScoreResponse>> futures = leads.stream()
                .map(lead -> CompletableFuture.supplyAsync(() -> score(lead), executor)
                        .exceptionally(ex -> {
                            Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
                            log.warn("Lead failed in batch: {}", cause.getMessage());
                            return LeadScoreResponse.failed(cause.getMessage());
                        }))
                .collect(Collectors.toList());
        List<LeadScoreResponse> results = futures.stream().map(CompletableFuture::join).collect(Collectors.toList());

        int successful = (int) results.stream().filter(LeadScoreResponse::isSuccess).count();
        return BatchScoreResponse.builder()
                .results(results)
                .total(results.size())
                .successful(successful)
                .failed(results.size() - successful)
                .build();
    }

    /**
     * Score an imported row in place. Rows already marked failed by the parser are left as is.
     */
    public LeadRecord scoreRecord(LeadRecord record) {
        if (record.getError() != null) {
            record.setSuccess(false);
            record.setScore(0);
            record.setPriorityLabel(Priority.JUNK.label());
            return record;
        }
        ScoredLead lead = engine.score(LeadInput.of(record.getRole(), record.getCompanySize(), record.getMessage()));
        record.setScore(lead.getScore());
        record.setPriorityLabel(lead.getPriorityLabel());
        record.setJustification(lead.getJustification());
        record.setSuccess(true);
        return record;
    }

    public List<LeadRecord> scoreRecords(List<LeadRecord> records) {
        List<CompletableFuture<LeadRecord>> futures = records.stream()
                .map(r -> CompletableFuture.supplyAsync(() -> scoreRecord(r), executor))
                .collect(Collectors.toList());
        return futures.stream().map(CompletableFuture::join).collect(Collectors.toList());
    }

    private void validate(LeadScoreRequest request) {
        if (request == null) {
            throw new InvalidLeadException("Lead is required");
        }
        if (request.getRole() == null || request.getCompanySize() == null || request.getMessage() == null) {
            throw new InvalidLeadException("Lead requires role, companySize and message");
        }
    }
}
