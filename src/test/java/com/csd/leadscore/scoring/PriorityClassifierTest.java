package com.csd.leadscore.scoring;

import com.csd.leadscore.model.Priority;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class PriorityClassifierTest {

    @Test
    void thresholds() {
        assertEquals(Priority.HIGH, PriorityClassifier.classify(100));
        assertEquals(Priority.HIGH, PriorityClassifier.classify(80));
        assertEquals(Priority.MEDIUM, PriorityClassifier.classify(79));
        assertEquals(Priority.MEDIUM, PriorityClassifier.classify(40));
        assertEquals(Priority.LOW, PriorityClassifier.classify(39));
        assertEquals(Priority.LOW, PriorityClassifier.classify(1));
        assertEquals(Priority.JUNK, PriorityClassifier.classify(0));
    }

    @Test
    void labels() {
        assertEquals("High Priority", Priority.HIGH.label());
        assertEquals("Medium Priority", Priority.MEDIUM.label());
        assertEquals("Low Priority", Priority.LOW.label());
        assertEquals("Junk/Error", Priority.JUNK.label());
        assertEquals("gray", Priority.JUNK.color());
    }

    @Test
    void reclassifyingIsStable() {
        for (int score = 0; score <= 100; score++) {
            Priority first = PriorityClassifier.classify(score);
            assertEquals(first, PriorityClassifier.classify(score));
            assertTrue(score >= first.floor());
        }
    }

    @Test
    void outOfRangeScoreIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> PriorityClassifier.classify(-1));
        assertThrows(IllegalArgumentException.class, () -> PriorityClassifier.classify(101));
    }
}
