package com.csd.leadscore.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Optional;

@Value
@Builder
public class ScoredLead {
    int score;
    Priority priority;
    String justification;
    ScoreBreakdown breakdown;
    @Singular
    List<SignalEvidence> signals;

    public String getPriorityLabel() {
        return priority.label();
    }

    public Optional<SignalEvidence> signal(SignalComponent component) {
        return signals.stream().filter(s -> s.getComponent() == component).findFirst();
    }
}
