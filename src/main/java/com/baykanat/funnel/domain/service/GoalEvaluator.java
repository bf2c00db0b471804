package com.baykanat.funnel.domain.service;

import com.baykanat.funnel.api.dto.FunnelReport;
import com.baykanat.funnel.domain.model.CompletionSets;
import com.baykanat.funnel.domain.model.FunnelStep;
import com.baykanat.funnel.domain.model.VisitorTimelines;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Tek adımlı hedef: tamamlayan ziyaretçiler sitenin toplam ziyaretçisine oranlanır; dropoff ve süre yok.
 * Payda screen_view ziyaretçileridir; yalnız custom_events ile gelen tamamlayanlar paydaya da eklenir, oran 100'ü geçmez.
 */
@Component
@RequiredArgsConstructor
public class GoalEvaluator {

    private final FunnelMatcher funnelMatcher;

    public FunnelReport evaluate(FunnelStep goal, VisitorTimelines timelines, long totalWebsiteUsers) {
        CompletionSets completions = funnelMatcher.matchAll(timelines, 1);
        long goalCompletions = completions.users(1);
        long baseline = Math.max(totalWebsiteUsers, goalCompletions);
        double conversionRate = MetricsAggregator.pct(goalCompletions, baseline);

        FunnelReport.StepMetrics step = FunnelReport.StepMetrics.builder()
                .stepNumber(1)
                .stepName(goal.getName())
                .users(goalCompletions)
                .totalUsers(baseline)
                .conversionRate(conversionRate)
                .dropoffs(0)
                .dropoffRate(0.0)
                .avgTimeToComplete(0.0)
                .build();

        return FunnelReport.builder()
                .overallConversionRate(conversionRate)
                .totalUsersEntered(baseline)
                .totalUsersCompleted(goalCompletions)
                .avgCompletionTime(0.0)
                .avgCompletionTimeFormatted(MetricsAggregator.formatDuration(0))
                .biggestDropoffStep(1)
                .biggestDropoffRate(0.0)
                .stepsAnalytics(List.of(step))
                .build();
    }
}
