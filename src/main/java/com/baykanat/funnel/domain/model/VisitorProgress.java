package com.baykanat.funnel.domain.model;

import lombok.Value;

import java.time.Instant;
import java.util.List;

/** Bir ziyaretçinin sırayla tamamladığı adımlar; completionTimes[i] = (i+1). adımın tamamlanma zamanı. */
@Value
public class VisitorProgress {

    String visitorId;
    List<Instant> completionTimes;

    public int completedSteps() {
        return completionTimes.size();
    }

    public boolean hasCompleted(int stepNumber) {
        return stepNumber >= 1 && stepNumber <= completionTimes.size();
    }

    public Instant completedAt(int stepNumber) {
        return completionTimes.get(stepNumber - 1);
    }
}
