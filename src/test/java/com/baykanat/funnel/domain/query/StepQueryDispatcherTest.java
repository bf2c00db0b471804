package com.baykanat.funnel.domain.query;

import com.baykanat.funnel.config.AppProperties;
import com.baykanat.funnel.domain.model.Filter;
import com.baykanat.funnel.domain.model.FunnelStep;
import com.baykanat.funnel.domain.model.QueryContext;
import com.baykanat.funnel.domain.model.StepKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for StepQueryDispatcher: SQL shape per step kind and parameter binding.
 */
class StepQueryDispatcherTest {

    private final StepQueryDispatcher dispatcher = new StepQueryDispatcher(new FilterCompiler(new AppProperties()));

    private final QueryContext context = QueryContext.builder()
            .websiteId("site-1")
            .startDate("2026-01-01")
            .endDate("2026-01-31 23:59:59")
            .build();

    @Test
    @DisplayName("Page view step - matches screen_view rows by exact or contained path")
    void pageViewStepQuery() {
        Map<String, Object> params = new HashMap<>();
        StepQuery query = dispatcher.dispatch(step(1, StepKind.PAGE_VIEW, "/pricing_v2"), 0, "", params, false);

        assertThat(query.getStepNumber()).isEqualTo(1);
        assertThat(query.getSql())
                .contains("e.event_name = 'screen_view'")
                .contains("(e.path = :target_0 OR e.path LIKE :target_0_like)")
                .doesNotContain("custom_events")
                .doesNotContain("visitor_referrers");
        assertThat(params)
                .containsEntry("target_0", "/pricing_v2")
                .containsEntry("target_0_like", "%/pricing\\_v2%");
    }

    @Test
    @DisplayName("Event step - unions events and custom_events on exact event name")
    void eventStepQuery() {
        Map<String, Object> params = new HashMap<>();
        StepQuery query = dispatcher.dispatch(step(2, StepKind.EVENT, "signup"), 1, " AND e.country = :f0_country",
                params, false);

        assertThat(query.getSql())
                .contains("FROM events e")
                .contains("FROM custom_events c")
                .contains("e.event_name = :target_1 AND e.country = :f0_country")
                .contains("c.event_name = :target_1")
                .contains("c.timestamp AS occurred_at");
        assertThat(params).containsEntry("target_1", "signup").containsEntry("step_name_1", "Step 2");
    }

    @Test
    @DisplayName("Funnel query - one UNION ALL branch per step, context and filters bound once")
    void funnelQueryUnionsSteps() {
        FunnelQuery query = dispatcher.buildFunnelQuery(
                List.of(step(1, StepKind.PAGE_VIEW, "/"), step(2, StepKind.EVENT, "signup"), step(3, StepKind.EVENT, "purchase")),
                List.of(new Filter("country", "equals", "TR")), context, false);

        assertThat(query.getSql().split("UNION ALL", -1)).hasSize(1 + 2 + 2);
        assertThat(query.getSql()).startsWith("WITH all_step_events AS (")
                .contains("SELECT DISTINCT step_number, step_name, visitor_id, occurred_at\n")
                .endsWith("ORDER BY visitor_id, occurred_at, step_number");
        assertThat(query.getParams())
                .containsEntry("websiteId", "site-1")
                .containsEntry("startDate", "2026-01-01")
                .containsEntry("endDate", "2026-01-31 23:59:59")
                .containsEntry("f0_country", "TR")
                .containsKeys("target_0", "target_1", "target_2");
        assertThat(query.isIncludeReferrer()).isFalse();
    }

    @Test
    @DisplayName("Referrer variant - first-touch referrer CTE joined into every step")
    void funnelQueryWithReferrer() {
        FunnelQuery query = dispatcher.buildFunnelQuery(
                List.of(step(1, StepKind.PAGE_VIEW, "/"), step(2, StepKind.EVENT, "signup")),
                List.of(), context, true);

        assertThat(query.getSql())
                .startsWith("WITH visitor_referrers AS (")
                .contains("DISTINCT ON (anonymous_id)")
                .contains("step_name, visitor_id, occurred_at, referrer");
        assertThat(query.getSql().split("LEFT JOIN visitor_referrers", -1)).hasSize(3);
        assertThat(query.isIncludeReferrer()).isTrue();
    }

    private static FunnelStep step(int number, StepKind kind, String target) {
        return FunnelStep.builder()
                .stepNumber(number)
                .name("Step " + number)
                .kind(kind)
                .target(target)
                .build();
    }
}
