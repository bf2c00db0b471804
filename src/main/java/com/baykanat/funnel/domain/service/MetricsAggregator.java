package com.baykanat.funnel.domain.service;

import com.baykanat.funnel.api.dto.FunnelReport;
import com.baykanat.funnel.domain.model.CompletionSets;
import com.baykanat.funnel.domain.model.FunnelStep;
import com.baykanat.funnel.domain.model.VisitorProgress;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * CompletionSets'ten dönüşüm, dropoff ve süre metriklerini hesaplar. Saf fonksiyon; aynı girdi aynı raporu verir.
 * Tüm oranlar pct() üzerinden: yüzde, iki ondalık, payda 0 ise 0.
 */
@Component
public class MetricsAggregator {

    static final String NO_DURATION = "\u2014";

    /** Funnel raporu; adım adları steps listesinden, kullanıcı sayıları completions'tan. */
    public FunnelReport aggregate(List<FunnelStep> steps, CompletionSets completions) {
        int stepCount = steps.size();
        long totalUsers = completions.users(1);
        List<FunnelReport.StepMetrics> metrics = new ArrayList<>(stepCount);

        for (int stepNumber = 1; stepNumber <= stepCount; stepNumber++) {
            long users = completions.users(stepNumber);
            long previousUsers = stepNumber > 1 ? completions.users(stepNumber - 1) : users;
            long dropoffs = stepNumber > 1 ? previousUsers - users : 0;

            metrics.add(FunnelReport.StepMetrics.builder()
                    .stepNumber(stepNumber)
                    .stepName(steps.get(stepNumber - 1).getName())
                    .users(users)
                    .totalUsers(totalUsers)
                    .conversionRate(stepNumber > 1 ? pct(users, previousUsers) : 100.0)
                    .dropoffs(dropoffs)
                    .dropoffRate(stepNumber > 1 ? pct(dropoffs, previousUsers) : 0.0)
                    .avgTimeToComplete(stepNumber > 1 ? round2(avgTransitionSeconds(completions, stepNumber)) : 0.0)
                    .build());
        }

        FunnelReport.StepMetrics biggestDropoff = biggestDropoff(metrics);
        long completedUsers = completions.users(stepCount);
        double avgCompletionTime = round2(avgCompletionSeconds(completions, stepCount));

        return FunnelReport.builder()
                .overallConversionRate(pct(completedUsers, totalUsers))
                .totalUsersEntered(totalUsers)
                .totalUsersCompleted(completedUsers)
                .avgCompletionTime(avgCompletionTime)
                .avgCompletionTimeFormatted(formatDuration(avgCompletionTime))
                .biggestDropoffStep(biggestDropoff != null ? biggestDropoff.getStepNumber() : 1)
                .biggestDropoffRate(biggestDropoff != null ? biggestDropoff.getDropoffRate() : 0.0)
                .stepsAnalytics(metrics)
                .build();
    }

    /** round((num / denom) * 10000) / 100; denom 0 ise 0. */
    public static double pct(long numerator, long denominator) {
        if (denominator == 0) {
            return 0.0;
        }
        return Math.round(((double) numerator / denominator) * 10000) / 100.0;
    }

    /** "Xh Ym", "Xm Ys", "Xs"; sıfır veya tanımsızsa em-dash. */
    public static String formatDuration(double seconds) {
        if (Double.isNaN(seconds) || seconds <= 0) {
            return NO_DURATION;
        }
        long total = Math.round(seconds);
        if (total == 0) {
            return NO_DURATION;
        }
        if (total >= 3600) {
            return (total / 3600) + "h " + ((total % 3600) / 60) + "m";
        }
        if (total >= 60) {
            return (total / 60) + "m " + (total % 60) + "s";
        }
        return total + "s";
    }

    static double round2(double value) {
        return Math.round(value * 100) / 100.0;
    }

    /** 2..N arasında en yüksek dropoff_rate; eşitlikte en erken adım. Tek adımda null. */
    private FunnelReport.StepMetrics biggestDropoff(List<FunnelReport.StepMetrics> metrics) {
        FunnelReport.StepMetrics biggest = null;
        for (int i = 1; i < metrics.size(); i++) {
            FunnelReport.StepMetrics step = metrics.get(i);
            if (biggest == null || step.getDropoffRate() > biggest.getDropoffRate()) {
                biggest = step;
            }
        }
        return biggest;
    }

    /** stepNumber'ı tamamlayanlar için (stepNumber-1 → stepNumber) geçiş süresi ortalaması. */
    private double avgTransitionSeconds(CompletionSets completions, int stepNumber) {
        Set<String> visitors = completions.visitors(stepNumber);
        if (visitors.isEmpty()) {
            return 0.0;
        }
        double sum = 0;
        for (String visitorId : visitors) {
            VisitorProgress progress = completions.progress(visitorId);
            sum += seconds(progress.completedAt(stepNumber - 1), progress.completedAt(stepNumber));
        }
        return sum / visitors.size();
    }

    /** Son adımı tamamlayanlar için (son adım - ilk adım) ortalaması. */
    private double avgCompletionSeconds(CompletionSets completions, int stepCount) {
        Set<String> completers = completions.visitors(stepCount);
        if (completers.isEmpty()) {
            return 0.0;
        }
        double sum = 0;
        for (String visitorId : completers) {
            VisitorProgress progress = completions.progress(visitorId);
            sum += seconds(progress.completedAt(1), progress.completedAt(stepCount));
        }
        return sum / completers.size();
    }

    private static double seconds(Instant from, Instant to) {
        return Duration.between(from, to).toMillis() / 1000.0;
    }
}
