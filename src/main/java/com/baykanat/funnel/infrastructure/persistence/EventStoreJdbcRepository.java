package com.baykanat.funnel.infrastructure.persistence;

import com.baykanat.funnel.config.AppProperties;
import com.baykanat.funnel.domain.exception.QueryFailedException;
import com.baykanat.funnel.domain.model.QueryContext;
import com.baykanat.funnel.domain.model.StepEvent;
import com.baykanat.funnel.domain.query.FunnelQuery;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Objects;

/** Event store okumaları; Retry + Circuit Breaker. Hata durumunda kısmi sonuç yok, tek QueryFailedException. */
@Slf4j
@Repository
@RequiredArgsConstructor
public class EventStoreJdbcRepository {

    private static final String EVENT_STORE = "eventStore";

    private static final String TOTAL_VISITORS_SQL = """
            SELECT COUNT(DISTINCT anonymous_id) AS total_users
            FROM events
            WHERE client_id = :websiteId
              AND time >= CAST(:startDate AS TIMESTAMP)
              AND time <= CAST(:endDate AS TIMESTAMP)
              AND event_name = 'screen_view'
            """;

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final AppProperties appProperties;

    /** Birleşik adım sorgusunu çalıştırır; satır başına bir StepEvent. */
    @CircuitBreaker(name = EVENT_STORE)
    @Retry(name = EVENT_STORE, fallbackMethod = "fetchStepEventsFallback")
    public List<StepEvent> fetchStepEvents(FunnelQuery query) {
        if (log.isDebugEnabled()) {
            log.debug("Funnel SQL:\n{}\nparams: {}", query.getSql(), query.getParams());
        }
        long start = System.currentTimeMillis();
        List<StepEvent> rows = jdbcTemplate.query(query.getSql(), new MapSqlParameterSource(query.getParams()),
                (rs, rowNum) -> mapStepEvent(rs, query.isIncludeReferrer()));
        log.debug("Fetched {} step events in {}ms", rows.size(), System.currentTimeMillis() - start);
        return rows;
    }

    /** events.time ve custom_events.timestamp zaman dilimsiz UTC değerlerdir; JVM dilimine çevrilmez. */
    static StepEvent mapStepEvent(ResultSet rs, boolean includeReferrer) throws SQLException {
        LocalDateTime occurredAt = Objects.requireNonNull(rs.getObject("occurred_at", LocalDateTime.class),
                "occurred_at");
        return StepEvent.builder()
                .stepNumber(rs.getInt("step_number"))
                .stepName(rs.getString("step_name"))
                .visitorId(rs.getString("visitor_id"))
                .occurredAt(occurredAt.toInstant(ZoneOffset.UTC))
                .referrer(includeReferrer ? rs.getString("referrer") : null)
                .build();
    }

    /** Aralıktaki screen_view'larda benzersiz ziyaretçi sayısı (hedef dönüşümünün paydası). */
    @CircuitBreaker(name = EVENT_STORE)
    @Retry(name = EVENT_STORE, fallbackMethod = "countDistinctVisitorsFallback")
    public long countDistinctVisitors(QueryContext context) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("websiteId", context.getWebsiteId())
                .addValue("startDate", context.getStartDate())
                .addValue("endDate", context.getEndDate());
        Long total = jdbcTemplate.queryForObject(TOTAL_VISITORS_SQL, params, Long.class);
        return total != null ? total : 0L;
    }

    /** Circuit breaker açıkken adım sorgusu için fallback. */
    @SuppressWarnings("unused")
    private List<StepEvent> fetchStepEventsFallback(FunnelQuery query, CallNotPermittedException ex) {
        log.error("Circuit breaker is OPEN for event store. Rejecting funnel query");
        throw failure("Event store is temporarily unavailable. Circuit breaker is open.", ex);
    }

    /** Tüm retry'lar tükendikten sonra adım sorgusu için fallback. */
    @SuppressWarnings("unused")
    private List<StepEvent> fetchStepEventsFallback(FunnelQuery query, Exception ex) {
        log.error("Funnel query failed after all retries: {}", ex.getMessage());
        throw failure("Event store query failed: " + ex.getMessage(), ex);
    }

    @SuppressWarnings("unused")
    private long countDistinctVisitorsFallback(QueryContext context, CallNotPermittedException ex) {
        log.error("Circuit breaker is OPEN for event store. Rejecting visitor count for website_id={}",
                context.getWebsiteId());
        throw failure("Event store is temporarily unavailable. Circuit breaker is open.", ex);
    }

    @SuppressWarnings("unused")
    private long countDistinctVisitorsFallback(QueryContext context, Exception ex) {
        log.error("Visitor count query failed for website_id={}: {}", context.getWebsiteId(), ex.getMessage());
        throw failure("Event store query failed: " + ex.getMessage(), ex);
    }

    private QueryFailedException failure(String message, Throwable cause) {
        return new QueryFailedException(message, cause, appProperties.getAnalytics().getRetryAfterSeconds());
    }
}
