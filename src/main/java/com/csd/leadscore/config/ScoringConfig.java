package com.csd.leadscore.config;

import com.csd.leadscore.exception.PatternCatalogException;
import com.csd.leadscore.scoring.LeadScoringEngine;
import com.csd.leadscore.scoring.PatternCatalog;
import com.csd.leadscore.scoring.PatternCatalogLoader;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Slf4j
@Configuration
public class ScoringConfig {

    /**
     * Loaded once at startup. A broken catalog fails bean creation, so the application never
     * starts serving without one.
     */
    @Bean
    public PatternCatalog patternCatalog(ResourceLoader resourceLoader,
                                         ObjectMapper objectMapper,
                                         @Value("${leadscore.catalog.location:classpath:lead-patterns.json}") String location) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            log.error("Pattern catalog not found at {}", location);
            throw new PatternCatalogException("Pattern catalog not found: " + location);
        }
        try (InputStream in = resource.getInputStream()) {
            return new PatternCatalogLoader(objectMapper).load(in);
        } catch (IOException e) {
            log.error("Failed to read pattern catalog {}", location, e);
            throw new PatternCatalogException("Failed to read pattern catalog " + location, e);
        }
    }

    @Bean
    public LeadScoringEngine leadScoringEngine(PatternCatalog patternCatalog) {
        return new LeadScoringEngine(patternCatalog);
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService batchScoringExecutor(@Value("${leadscore.batch.max-concurrency:100}") int maxConcurrency) {
        log.info("Batch scoring executor with {} workers", maxConcurrency);
        return Executors.newFixedThreadPool(Math.max(1, maxConcurrency));
    }
}
