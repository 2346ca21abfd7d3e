package com.csd.leadscore.scoring;

import com.csd.leadscore.model.Priority;

public final class PriorityClassifier {
    private PriorityClassifier() {}

    /**
     * Map a final score to its bucket, checking floors from High down to Junk.
     *
     * @throws IllegalArgumentException if the score is outside [0, 100]
     */
    public static Priority classify(int score) {
        if (score < ScoreAggregator.MIN_SCORE || score > ScoreAggregator.MAX_SCORE) {
            throw new IllegalArgumentException("Score out of range [0,100]: " + score);
        }
        for (Priority priority : Priority.values()) {
            if (score >= priority.floor()) {
                return priority;
            }
        }
        return Priority.JUNK;
    }
}
