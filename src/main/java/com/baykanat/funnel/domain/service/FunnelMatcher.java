package com.baykanat.funnel.domain.service;

import com.baykanat.funnel.domain.model.CompletionSets;
import com.baykanat.funnel.domain.model.StepEvent;
import com.baykanat.funnel.domain.model.VisitorProgress;
import com.baykanat.funnel.domain.model.VisitorTimelines;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Sıralı funnel eşleştirici. Her ziyaretçi için tek bir "beklenen adım" imleci tutulur (1..N+1):
 * yalnızca beklenen adımın event'i imleci ilerletir, diğer her event yok sayılır.
 * Böylece bir adım en fazla bir kez ve sadece önceki adımdan sonra sayılır.
 */
@Component
public class FunnelMatcher {

    /** Sıralı zaman çizelgesini tarar; imleç N+1'e ulaşınca kalan event'ler okunmaz. */
    public VisitorProgress match(String visitorId, List<StepEvent> sortedTimeline, int stepCount) {
        List<Instant> completionTimes = new ArrayList<>(stepCount);
        int expected = 1;

        for (StepEvent event : sortedTimeline) {
            if (expected > stepCount) {
                break;
            }
            if (event.getStepNumber() == expected) {
                completionTimes.add(event.getOccurredAt());
                expected++;
            }
        }

        return new VisitorProgress(visitorId, List.copyOf(completionTimes));
    }

    /** Tüm ziyaretçiler için eşleştirir; 1. adımı hiç yapmayan ziyaretçi hiçbir kümede yer almaz. */
    public CompletionSets matchAll(VisitorTimelines timelines, int stepCount) {
        List<Set<String>> visitorsByStep = new ArrayList<>(stepCount);
        for (int i = 0; i < stepCount; i++) {
            visitorsByStep.add(new LinkedHashSet<>());
        }
        Map<String, VisitorProgress> progressByVisitor = new LinkedHashMap<>();

        for (Map.Entry<String, List<StepEvent>> entry : timelines.asMap().entrySet()) {
            VisitorProgress progress = match(entry.getKey(), entry.getValue(), stepCount);
            if (progress.completedSteps() == 0) {
                continue;
            }
            progressByVisitor.put(entry.getKey(), progress);
            for (int i = 0; i < progress.completedSteps(); i++) {
                visitorsByStep.get(i).add(entry.getKey());
            }
        }

        return new CompletionSets(stepCount, visitorsByStep, progressByVisitor);
    }
}
