package com.baykanat.funnel.domain.service;

import com.baykanat.funnel.api.dto.FunnelReport;
import com.baykanat.funnel.domain.model.CompletionSets;
import com.baykanat.funnel.domain.model.FunnelStep;
import com.baykanat.funnel.domain.model.StepKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.baykanat.funnel.domain.service.TimelineAssemblerTest.event;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for MetricsAggregator.
 *
 * <p>Covers the landing → signup → purchase scenario, the zero-safe percentage helper,
 * duration formatting and biggest-dropoff selection.
 */
class MetricsAggregatorTest {

    private static final List<FunnelStep> STEPS = List.of(
            step(1, StepKind.PAGE_VIEW, "/landing", "view_landing"),
            step(2, StepKind.EVENT, "signup", "signup"),
            step(3, StepKind.EVENT, "purchase", "purchase"));

    private final TimelineAssembler assembler = new TimelineAssembler();
    private final FunnelMatcher matcher = new FunnelMatcher();
    private final MetricsAggregator aggregator = new MetricsAggregator();

    @Test
    @DisplayName("Three-step funnel - visitor skipping signup counts only at step 1")
    void landingSignupPurchase() {
        CompletionSets sets = matcher.matchAll(assembler.assemble(List.of(
                event(1, "A", 0), event(2, "A", 10), event(3, "A", 20),
                event(1, "B", 0), event(3, "B", 5))), 3);

        FunnelReport report = aggregator.aggregate(STEPS, sets);

        assertThat(report.getStepsAnalytics()).extracting(FunnelReport.StepMetrics::getUsers).containsExactly(2L, 1L, 1L);
        assertThat(report.getStepsAnalytics()).extracting(FunnelReport.StepMetrics::getConversionRate)
                .containsExactly(100.0, 50.0, 100.0);
        assertThat(report.getStepsAnalytics().get(1).getDropoffs()).isEqualTo(1);
        assertThat(report.getStepsAnalytics().get(1).getDropoffRate()).isEqualTo(50.0);
        assertThat(report.getStepsAnalytics().get(2).getAvgTimeToComplete()).isEqualTo(10.0);
        assertThat(report.getAvgCompletionTime()).isEqualTo(20.0);
        assertThat(report.getAvgCompletionTimeFormatted()).isEqualTo("20s");
        assertThat(report.getTotalUsersEntered()).isEqualTo(2);
        assertThat(report.getTotalUsersCompleted()).isEqualTo(1);
        assertThat(report.getOverallConversionRate()).isEqualTo(50.0);
        assertThat(report.getBiggestDropoffStep()).isEqualTo(2);
        assertThat(report.getBiggestDropoffRate()).isEqualTo(50.0);
    }

    @Test
    @DisplayName("First step - always 100% conversion and no dropoffs, even with no visitors")
    void firstStepInvariant() {
        FunnelReport report = aggregator.aggregate(STEPS, matcher.matchAll(assembler.assemble(List.of()), 3));

        FunnelReport.StepMetrics first = report.getStepsAnalytics().get(0);
        assertThat(first.getConversionRate()).isEqualTo(100.0);
        assertThat(first.getDropoffs()).isZero();
        assertThat(report.getOverallConversionRate()).isZero();
        assertThat(report.getAvgCompletionTime()).isZero();
        assertThat(report.getAvgCompletionTimeFormatted()).isEqualTo(MetricsAggregator.NO_DURATION);
    }

    @Test
    @DisplayName("Biggest dropoff - highest rate wins")
    void biggestDropoffHighestRate() {
        CompletionSets sets = matcher.matchAll(assembler.assemble(List.of(
                event(1, "a", 0), event(2, "a", 1), event(3, "a", 2),
                event(1, "b", 0), event(2, "b", 1),
                event(1, "c", 0), event(2, "c", 1), event(3, "c", 2),
                event(1, "d", 0))), 3);

        FunnelReport report = aggregator.aggregate(STEPS, sets);

        // step 2: 1 of 4 lost (25%), step 3: 1 of 3 lost (33.33%)
        assertThat(report.getBiggestDropoffStep()).isEqualTo(3);
        assertThat(report.getBiggestDropoffRate()).isEqualTo(33.33);
    }

    @Test
    @DisplayName("Biggest dropoff - equal rates go to the earliest step")
    void biggestDropoffTieBreak() {
        CompletionSets sets = matcher.matchAll(assembler.assemble(List.of(
                event(1, "a", 0), event(2, "a", 1), event(3, "a", 2),
                event(1, "b", 0), event(2, "b", 1),
                event(1, "c", 0),
                event(1, "d", 0))), 3);

        FunnelReport report = aggregator.aggregate(STEPS, sets);

        // step 2: 2 of 4 lost, step 3: 1 of 2 lost; both 50%
        assertThat(report.getBiggestDropoffStep()).isEqualTo(2);
        assertThat(report.getBiggestDropoffRate()).isEqualTo(50.0);
    }

    @Test
    @DisplayName("Biggest dropoff - no losses points at step 2 with 0%")
    void biggestDropoffWithoutLosses() {
        CompletionSets sets = matcher.matchAll(assembler.assemble(List.of(
                event(1, "a", 0), event(2, "a", 1), event(3, "a", 2))), 3);

        FunnelReport report = aggregator.aggregate(STEPS, sets);

        assertThat(report.getBiggestDropoffStep()).isEqualTo(2);
        assertThat(report.getBiggestDropoffRate()).isZero();
    }

    @Test
    @DisplayName("Single-step funnel - biggest dropoff defaults to step 1 with 0%")
    void singleStepFunnel() {
        CompletionSets sets = matcher.matchAll(assembler.assemble(List.of(event(1, "a", 0))), 1);

        FunnelReport report = aggregator.aggregate(STEPS.subList(0, 1), sets);

        assertThat(report.getBiggestDropoffStep()).isEqualTo(1);
        assertThat(report.getBiggestDropoffRate()).isZero();
        assertThat(report.getOverallConversionRate()).isEqualTo(100.0);
    }

    @Test
    @DisplayName("pct - zero denominator yields 0, two decimals otherwise")
    void pctIsZeroSafe() {
        assertThat(MetricsAggregator.pct(5, 0)).isZero();
        assertThat(MetricsAggregator.pct(0, 0)).isZero();
        assertThat(MetricsAggregator.pct(1, 3)).isEqualTo(33.33);
        assertThat(MetricsAggregator.pct(2, 3)).isEqualTo(66.67);
        assertThat(MetricsAggregator.pct(37, 100)).isEqualTo(37.0);
    }

    @Test
    @DisplayName("formatDuration - hours, minutes, seconds and empty")
    void formatsDurations() {
        assertThat(MetricsAggregator.formatDuration(3725)).isEqualTo("1h 2m");
        assertThat(MetricsAggregator.formatDuration(754.5)).isEqualTo("12m 35s");
        assertThat(MetricsAggregator.formatDuration(59.4)).isEqualTo("59s");
        assertThat(MetricsAggregator.formatDuration(0)).isEqualTo(MetricsAggregator.NO_DURATION);
        assertThat(MetricsAggregator.formatDuration(0.2)).isEqualTo(MetricsAggregator.NO_DURATION);
    }

    @Test
    @DisplayName("Aggregation is pure - same completion sets give equal reports")
    void aggregationIsPure() {
        CompletionSets sets = matcher.matchAll(assembler.assemble(List.of(
                event(1, "A", 0), event(2, "A", 10), event(3, "A", 20),
                event(1, "B", 0))), 3);

        assertThat(aggregator.aggregate(STEPS, sets)).isEqualTo(aggregator.aggregate(STEPS, sets));
    }

    private static FunnelStep step(int number, StepKind kind, String target, String name) {
        return FunnelStep.builder().stepNumber(number).kind(kind).target(target).name(name).build();
    }
}
