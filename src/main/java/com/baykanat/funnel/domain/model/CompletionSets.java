package com.baykanat.funnel.domain.model;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** step_number → o adıma sırayla ulaşan ziyaretçiler, ve ziyaretçi bazında tamamlama zamanları. */
public final class CompletionSets {

    private final int stepCount;
    private final List<Set<String>> visitorsByStep;
    private final Map<String, VisitorProgress> progress;

    public CompletionSets(int stepCount, List<Set<String>> visitorsByStep, Map<String, VisitorProgress> progress) {
        if (visitorsByStep.size() != stepCount) {
            throw new IllegalArgumentException("Expected " + stepCount + " completion sets, got " + visitorsByStep.size());
        }
        this.stepCount = stepCount;
        this.visitorsByStep = visitorsByStep.stream().map(Collections::unmodifiableSet).toList();
        this.progress = Collections.unmodifiableMap(progress);
    }

    public int getStepCount() {
        return stepCount;
    }

    public Set<String> visitors(int stepNumber) {
        if (stepNumber < 1 || stepNumber > stepCount) {
            return Set.of();
        }
        return visitorsByStep.get(stepNumber - 1);
    }

    public int users(int stepNumber) {
        return visitors(stepNumber).size();
    }

    public VisitorProgress progress(String visitorId) {
        return progress.get(visitorId);
    }

    public Map<String, VisitorProgress> getProgress() {
        return progress;
    }
}
