package com.csd.leadscore.scoring;

import com.csd.leadscore.model.Priority;
import com.csd.leadscore.model.ScoredLead;
import com.csd.leadscore.model.SignalComponent;
import com.csd.leadscore.model.SizeCategory;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class LeadScoringEngineTest {

    private final LeadScoringEngine engine = new LeadScoringEngine(PatternCatalogLoader.loadDefault());

    @Test
    void executiveWithUrgencyBudgetAndScaleClampsToHundred() {
        ScoredLead lead = engine.score("CTO", "1000+", "Urgent migration needed, budget approved, 500+ users");

        assertEquals(100, lead.getScore());
        assertEquals(Priority.HIGH, lead.getPriority());
        assertEquals("High Priority", lead.getPriorityLabel());
        assertEquals(25, lead.getBreakdown().getRole());
        assertEquals(40, lead.getBreakdown().getKeyword());
        assertEquals(10, lead.getBreakdown().getUrgency());
        assertEquals(15, lead.getBreakdown().getBudget());
        assertEquals(15, lead.getBreakdown().getScale());
        assertEquals(0, new BigDecimal("1.5").compareTo(lead.getBreakdown().getSizeMultiplier()));
        assertEquals(125, lead.getBreakdown().preMultiplierTotal());
        assertEquals("C-suite authority, urgent signals, budget mentioned, enterprise scale", lead.getJustification());
    }

    @Test
    void studentAskingForFreeAccessIsJunk() {
        ScoredLead lead = engine.score("Student", "1-10", "I'm a student working on a thesis, can I get free access?");

        assertEquals(-70, lead.getBreakdown().getKeyword());
        assertTrue(lead.getBreakdown().preMultiplierTotal() <= 0);
        assertEquals(0, lead.getScore());
        assertEquals(Priority.JUNK, lead.getPriority());
        assertEquals("Junk/Error", lead.getPriorityLabel());
        assertEquals("Poor fit or spam indicators", lead.getJustification());
    }

    @Test
    void managerAskingForDemoIsMedium() {
        ScoredLead lead = engine.score("Marketing Manager", "50-200", "Interested in a demo, considering your product");

        assertEquals(57, lead.getScore());
        assertEquals("Medium Priority", lead.getPriorityLabel());
        assertEquals(15, lead.getBreakdown().getRole());
        assertEquals(22, lead.getBreakdown().getKeyword());
        assertEquals("Decision maker role", lead.getJustification());
    }

    @Test
    void unknownCompanySizeDefaultsToNeutralMultiplier() {
        ScoredLead lead = engine.score("Engineer", "N/A", "");

        assertEquals(0, BigDecimal.ONE.compareTo(lead.getBreakdown().getSizeMultiplier()));
        assertEquals(25, lead.getScore());
        assertEquals(SizeCategory.MID_MARKET.label(), lead.signal(SignalComponent.COMPANY_SIZE).orElseThrow().getLabel());
        assertFalse(lead.signal(SignalComponent.COMPANY_SIZE).orElseThrow().flag("known_size"));
    }

    @Test
    void emptyAndNullInputsScoreBaseAndRoleDefault() {
        ScoredLead empty = engine.score("", "", "");
        ScoredLead nulls = engine.score(null, null, null);

        assertEquals(25, empty.getScore());
        assertEquals(Priority.LOW, empty.getPriority());
        assertEquals("Low fit, limited positive signals", empty.getJustification());
        assertEquals(empty, nulls);
    }

    @Test
    void repeatedCallsAreIdentical() {
        ScoredLead first = engine.score("VP Sales", "200-500", "Need a demo asap, $20k budget, 150 employees");
        for (int i = 0; i < 20; i++) {
            assertEquals(first, engine.score("VP Sales", "200-500", "Need a demo asap, $20k budget, 150 employees"));
        }
    }

    @Test
    void scoreAlwaysWithinBounds() {
        List<String> messages = List.of(
                "",
                "spam click here make money earn free student homework resume",
                "urgent asap emergency critical deadline need now $1,000,000 budget approved funding secured 100000 users",
                "x".repeat(5000),
                "99999999999999999999 users");
        for (String size : List.of("1-10", "1000+", "bogus")) {
            for (String message : messages) {
                int score = engine.score("CEO", size, message).getScore();
                assertTrue(score >= 0 && score <= 100, "score " + score + " for " + message);
            }
        }
    }

    @Test
    void largerCompanyNeverLowersNonNegativeScore() {
        List<String> tiers = List.of("1-10", "10-50", "50-200", "200-500", "500-1000", "1000+");
        String message = "Looking to evaluate pricing for 60 staff";
        int previous = -1;
        for (String tier : tiers) {
            ScoredLead lead = engine.score("Analyst", tier, message);
            assertTrue(lead.getBreakdown().preMultiplierTotal() >= 0);
            assertTrue(lead.getScore() >= previous, tier + " lowered the score");
            previous = lead.getScore();
        }
    }

    @Test
    void overlappingKeywordsBothCount() {
        int one = engine.score("", "50-200", "urgent").getScore();
        int both = engine.score("", "50-200", "urgent asap").getScore();

        assertEquals(50, one);
        assertEquals(65, both);
        assertTrue(both >= one);
    }

    @Test
    void everyDetectorReportsEvidence() {
        ScoredLead lead = engine.score("Director", "500-1000", "hello");
        for (SignalComponent component : SignalComponent.values()) {
            assertTrue(lead.signal(component).isPresent(), component + " missing");
        }
    }

    @Test
    void priorityMatchesClassifierForEveryResult() {
        for (String message : List.of("", "demo", "urgent demo", "student", "budget approved 500 users asap")) {
            ScoredLead lead = engine.score("Lead Engineer", "200-500", message);
            assertEquals(PriorityClassifier.classify(lead.getScore()), lead.getPriority());
        }
    }
}
