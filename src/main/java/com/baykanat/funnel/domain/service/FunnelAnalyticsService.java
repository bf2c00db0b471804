package com.baykanat.funnel.domain.service;

import com.baykanat.funnel.api.dto.FunnelReport;
import com.baykanat.funnel.api.dto.ReferrerAnalyticsResponse;
import com.baykanat.funnel.api.dto.ReferrerSegment;
import com.baykanat.funnel.domain.exception.InvalidArgumentException;
import com.baykanat.funnel.domain.model.CompletionSets;
import com.baykanat.funnel.domain.model.Filter;
import com.baykanat.funnel.domain.model.FunnelStep;
import com.baykanat.funnel.domain.model.QueryContext;
import com.baykanat.funnel.domain.model.StepEvent;
import com.baykanat.funnel.domain.model.VisitorTimelines;
import com.baykanat.funnel.domain.query.FunnelQuery;
import com.baykanat.funnel.domain.query.StepQueryDispatcher;
import com.baykanat.funnel.infrastructure.persistence.EventStoreJdbcRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Funnel hesaplama hattı: sorgu → timeline → eşleştirme → metrikler.
 * Tek istek içinde senkron; store hatası QueryFailedException olarak yukarı çıkar, kısmi rapor üretilmez.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FunnelAnalyticsService {

    private final StepQueryDispatcher queryDispatcher;
    private final EventStoreJdbcRepository eventStore;
    private final TimelineAssembler timelineAssembler;
    private final FunnelMatcher funnelMatcher;
    private final MetricsAggregator metricsAggregator;
    private final ReferrerSegmenter referrerSegmenter;
    private final GoalEvaluator goalEvaluator;

    /** Adım bazlı funnel raporu. */
    public FunnelReport analyzeFunnel(List<FunnelStep> steps, List<Filter> filters, QueryContext context) {
        validateSteps(steps);
        VisitorTimelines timelines = fetchTimelines(steps, filters, context, false);
        CompletionSets completions = funnelMatcher.matchAll(timelines, steps.size());
        FunnelReport report = metricsAggregator.aggregate(steps, completions);

        log.info("Funnel analyzed: website_id={}, steps={}, entered={}, completed={}",
                context.getWebsiteId(), steps.size(), report.getTotalUsersEntered(), report.getTotalUsersCompleted());
        return report;
    }

    /** İlk temas referrer'ına göre gruplanmış funnel dönüşümü. */
    public ReferrerAnalyticsResponse analyzeByReferrer(List<FunnelStep> steps, List<Filter> filters, QueryContext context) {
        validateSteps(steps);
        VisitorTimelines timelines = fetchTimelines(steps, filters, context, true);
        List<ReferrerSegment> segments = referrerSegmenter.segment(timelines, steps.size());

        log.info("Referrer analysis: website_id={}, visitors={}, segments={}",
                context.getWebsiteId(), timelines.size(), segments.size());
        return ReferrerAnalyticsResponse.builder()
                .referrerAnalytics(segments)
                .build();
    }

    /** Tek adımlı hedef; payda çağıran tarafından verilen site ziyaretçi sayısı. */
    public FunnelReport analyzeGoal(FunnelStep goal, List<Filter> filters, QueryContext context, long totalWebsiteUsers) {
        validateSteps(List.of(goal));
        VisitorTimelines timelines = fetchTimelines(List.of(goal), filters, context, false);
        FunnelReport report = goalEvaluator.evaluate(goal, timelines, totalWebsiteUsers);

        log.info("Goal analyzed: website_id={}, goal={}, completions={}, baseline={}",
                context.getWebsiteId(), goal.getName(), report.getTotalUsersCompleted(), totalWebsiteUsers);
        return report;
    }

    /** Aralıktaki benzersiz site ziyaretçisi (screen_view). */
    public long countWebsiteVisitors(QueryContext context) {
        return eventStore.countDistinctVisitors(context);
    }

    /** Boş liste, 1..N dışı numara, eksik tür/hedef/ad → InvalidArgumentException; store'a gidilmez. */
    void validateSteps(List<FunnelStep> steps) {
        if (steps == null || steps.isEmpty()) {
            throw new InvalidArgumentException("Funnel must have at least one step");
        }
        for (int i = 0; i < steps.size(); i++) {
            FunnelStep step = steps.get(i);
            if (step == null) {
                throw new InvalidArgumentException("Step at position " + (i + 1) + " is missing");
            }
            if (step.getStepNumber() != i + 1) {
                throw new InvalidArgumentException("Step numbers must be contiguous from 1; expected "
                        + (i + 1) + " but got " + step.getStepNumber());
            }
            if (step.getKind() == null) {
                throw new InvalidArgumentException("Step " + (i + 1) + " has no type");
            }
            if (step.getTarget() == null || step.getTarget().isBlank()) {
                throw new InvalidArgumentException("Step " + (i + 1) + " has no target");
            }
            if (step.getName() == null || step.getName().isBlank()) {
                throw new InvalidArgumentException("Step " + (i + 1) + " has no name");
            }
        }
    }

    private VisitorTimelines fetchTimelines(List<FunnelStep> steps, List<Filter> filters,
                                            QueryContext context, boolean includeReferrer) {
        FunnelQuery query = queryDispatcher.buildFunnelQuery(steps, filters == null ? List.of() : filters,
                context, includeReferrer);
        List<StepEvent> rows = eventStore.fetchStepEvents(query);
        return timelineAssembler.assemble(rows);
    }
}
