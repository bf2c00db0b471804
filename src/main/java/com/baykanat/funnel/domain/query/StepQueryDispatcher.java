package com.baykanat.funnel.domain.query;

import com.baykanat.funnel.domain.model.Filter;
import com.baykanat.funnel.domain.model.FunnelStep;
import com.baykanat.funnel.domain.model.QueryContext;
import com.baykanat.funnel.domain.model.StepKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Funnel adımlarını event store sorgularına çevirir.
 * PAGE_VIEW: screen_view satırları, path tam eşleşme veya içerme. EVENT: events ve custom_events birleşimi, event adı tam eşleşme.
 * Referrer atfı istenirse her adım ziyaretçinin aralıktaki ilk referrer'ı ile LEFT JOIN edilir.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StepQueryDispatcher {

    static final String PAGE_VIEW_EVENT = "screen_view";
    private static final String EVENTS_ALIAS = "e";

    private static final String VISITOR_REFERRERS_CTE = """
            visitor_referrers AS (
                SELECT DISTINCT ON (anonymous_id)
                       anonymous_id,
                       referrer AS visitor_referrer
                FROM events
                WHERE client_id = :websiteId
                  AND time >= CAST(:startDate AS TIMESTAMP)
                  AND time <= CAST(:endDate AS TIMESTAMP)
                  AND event_name = 'screen_view'
                  AND referrer IS NOT NULL
                  AND referrer <> ''
                ORDER BY anonymous_id, time
            )""";

    private final FilterCompiler filterCompiler;

    /** Tüm adımları tek UNION ALL sorgusunda toplar; satırlar (step_number, step_name, visitor_id, occurred_at) bazında tekilleşir. */
    public FunnelQuery buildFunnelQuery(List<FunnelStep> steps, List<Filter> filters,
                                        QueryContext context, boolean includeReferrer) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("websiteId", context.getWebsiteId());
        params.put("startDate", context.getStartDate());
        params.put("endDate", context.getEndDate());

        CompiledFilter compiled = filterCompiler.compile(filters, EVENTS_ALIAS, params);

        List<String> stepSql = new ArrayList<>(steps.size());
        for (int i = 0; i < steps.size(); i++) {
            stepSql.add(dispatch(steps.get(i), i, compiled.getPredicate(), params, includeReferrer).getSql());
        }

        StringBuilder sql = new StringBuilder("WITH ");
        if (includeReferrer) {
            sql.append(VISITOR_REFERRERS_CTE).append(",\n");
        }
        sql.append("all_step_events AS (\n")
                .append(String.join("\nUNION ALL\n", stepSql))
                .append("\n)\n")
                .append("SELECT DISTINCT step_number, step_name, visitor_id, occurred_at")
                .append(includeReferrer ? ", referrer" : "")
                .append("\nFROM all_step_events\n")
                .append("ORDER BY visitor_id, occurred_at, step_number");

        return new FunnelQuery(sql.toString(), params, includeReferrer);
    }

    /** Tek adımın SELECT'i; hedef ve adım adı parametreleri adım sırasıyla nitelenir (target_0, step_name_0 ...). */
    public StepQuery dispatch(FunnelStep step, int stepIndex, String filterPredicate,
                              Map<String, Object> params, boolean includeReferrer) {
        String stepNameKey = "step_name_" + stepIndex;
        String targetKey = "target_" + stepIndex;
        params.put(stepNameKey, step.getName());
        params.put(targetKey, step.getTarget());

        String sql = step.getKind() == StepKind.PAGE_VIEW
                ? pageViewQuery(step.getStepNumber(), stepNameKey, targetKey, filterPredicate, params, includeReferrer)
                : eventQuery(step.getStepNumber(), stepNameKey, targetKey, filterPredicate, includeReferrer);
        return new StepQuery(step.getStepNumber(), sql);
    }

    private String pageViewQuery(int stepNumber, String stepNameKey, String targetKey, String filterPredicate,
                                 Map<String, Object> params, boolean includeReferrer) {
        String likeKey = targetKey + "_like";
        params.put(likeKey, "%" + FilterCompiler.escapeLikeWildcards((String) params.get(targetKey)) + "%");

        return String.format("""
                SELECT %d AS step_number,
                       CAST(:%s AS TEXT) AS step_name,
                       e.anonymous_id AS visitor_id,
                       e.time AS occurred_at%s
                FROM events e%s
                WHERE e.client_id = :websiteId
                  AND e.time >= CAST(:startDate AS TIMESTAMP)
                  AND e.time <= CAST(:endDate AS TIMESTAMP)
                  AND e.event_name = '%s'
                  AND (e.path = :%s OR e.path LIKE :%s)%s""",
                stepNumber, stepNameKey,
                includeReferrer ? ",\n       COALESCE(vr.visitor_referrer, '') AS referrer" : "",
                includeReferrer ? "\nLEFT JOIN visitor_referrers vr ON vr.anonymous_id = e.anonymous_id" : "",
                PAGE_VIEW_EVENT, targetKey, likeKey, filterPredicate);
    }

    private String eventQuery(int stepNumber, String stepNameKey, String targetKey, String filterPredicate,
                              boolean includeReferrer) {
        // custom_events'te filtrelenebilir kolon yok; filtreler yalnızca events tarafına uygulanır
        return String.format("""
                SELECT %d AS step_number,
                       CAST(:%s AS TEXT) AS step_name,
                       u.visitor_id,
                       u.occurred_at%s
                FROM (
                    SELECT e.anonymous_id AS visitor_id, e.time AS occurred_at
                    FROM events e
                    WHERE e.client_id = :websiteId
                      AND e.time >= CAST(:startDate AS TIMESTAMP)
                      AND e.time <= CAST(:endDate AS TIMESTAMP)
                      AND e.event_name = :%s%s
                    UNION ALL
                    SELECT c.anonymous_id AS visitor_id, c.timestamp AS occurred_at
                    FROM custom_events c
                    WHERE c.client_id = :websiteId
                      AND c.timestamp >= CAST(:startDate AS TIMESTAMP)
                      AND c.timestamp <= CAST(:endDate AS TIMESTAMP)
                      AND c.event_name = :%s
                ) u%s""",
                stepNumber, stepNameKey,
                includeReferrer ? ",\n       COALESCE(vr.visitor_referrer, '') AS referrer" : "",
                targetKey, filterPredicate, targetKey,
                includeReferrer ? "\nLEFT JOIN visitor_referrers vr ON vr.anonymous_id = u.visitor_id" : "");
    }
}
