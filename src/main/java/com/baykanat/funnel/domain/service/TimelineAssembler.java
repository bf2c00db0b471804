package com.baykanat.funnel.domain.service;

import com.baykanat.funnel.domain.model.StepEvent;
import com.baykanat.funnel.domain.model.VisitorTimelines;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Ham satırları ziyaretçi bazında gruplar; her zaman çizelgesi zamana göre, eşitlikte geliş sırasına göre sıralanır. */
@Component
public class TimelineAssembler {

    private static final Comparator<StepEvent> BY_OCCURRED_AT = Comparator.comparing(StepEvent::getOccurredAt);

    /** Tek geçiş; (step_number, step_name, visitor_id, occurred_at) tekrarları atlanır. */
    public VisitorTimelines assemble(List<StepEvent> rows) {
        Map<String, List<StepEvent>> byVisitor = new LinkedHashMap<>();
        Set<List<Object>> seen = new HashSet<>();

        for (StepEvent row : rows) {
            List<Object> key = Arrays.asList(row.getStepNumber(), row.getStepName(), row.getVisitorId(), row.getOccurredAt());
            if (!seen.add(key)) {
                continue;
            }
            byVisitor.computeIfAbsent(row.getVisitorId(), id -> new ArrayList<>()).add(row);
        }

        // List.sort stabil: aynı zamandaki event'ler geliş sırasını korur
        byVisitor.values().forEach(timeline -> timeline.sort(BY_OCCURRED_AT));
        return new VisitorTimelines(byVisitor);
    }
}
