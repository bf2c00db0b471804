package com.baykanat.funnel.domain.service;

import com.baykanat.funnel.api.dto.BulkGoalAnalyticsRequest;
import com.baykanat.funnel.api.dto.FunnelReport;
import com.baykanat.funnel.api.dto.GoalRequest;
import com.baykanat.funnel.api.dto.GoalResponse;
import com.baykanat.funnel.api.dto.GoalUpdateRequest;
import com.baykanat.funnel.config.AppProperties;
import com.baykanat.funnel.domain.exception.NotFoundException;
import com.baykanat.funnel.domain.exception.QueryFailedException;
import com.baykanat.funnel.domain.mapper.FilterMapper;
import com.baykanat.funnel.domain.mapper.GoalMapper;
import com.baykanat.funnel.domain.model.DateRange;
import com.baykanat.funnel.domain.model.GoalDefinition;
import com.baykanat.funnel.domain.model.QueryContext;
import com.baykanat.funnel.infrastructure.persistence.GoalDefinitionJdbcRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/** Hedefler: CRUD, tekil analiz ve paralel toplu analiz. */
@Slf4j
@Service
@RequiredArgsConstructor
public class GoalService {

    private final GoalDefinitionJdbcRepository goalRepository;
    private final GoalMapper goalMapper;
    private final FilterMapper filterMapper;
    private final FunnelAnalyticsService analyticsService;
    private final DateRangeResolver dateRangeResolver;
    private final AppProperties appProperties;
    private final Clock clock;
    @Qualifier("analyticsExecutor")
    private final ExecutorService analyticsExecutor;

    public List<GoalResponse> list(String websiteId) {
        return goalRepository.findByWebsite(websiteId).stream()
                .map(goalMapper::toResponse)
                .toList();
    }

    public GoalResponse get(String websiteId, String goalId) {
        return goalMapper.toResponse(load(websiteId, goalId));
    }

    public GoalResponse create(String websiteId, GoalRequest request) {
        GoalDefinition goal = goalMapper.toDefinition(request);
        Instant now = Instant.now(clock);
        goal.setId(UUID.randomUUID().toString());
        goal.setWebsiteId(websiteId);
        goal.setCreatedAt(now);
        goal.setUpdatedAt(now);

        goalRepository.insert(goal);
        log.info("Goal created: id={}, website_id={}, type={}", goal.getId(), websiteId, goal.getType());
        return goalMapper.toResponse(goal);
    }

    public GoalResponse update(String websiteId, String goalId, GoalUpdateRequest request) {
        GoalDefinition goal = load(websiteId, goalId);
        goalMapper.applyUpdate(request, filterMapper, goal);
        goal.setUpdatedAt(Instant.now(clock));

        if (goalRepository.update(goal) == 0) {
            throw notFound(goalId);
        }
        log.info("Goal updated: id={}, website_id={}", goalId, websiteId);
        return goalMapper.toResponse(goal);
    }

    public void delete(String websiteId, String goalId) {
        if (goalRepository.softDelete(websiteId, goalId, Instant.now(clock)) == 0) {
            throw notFound(goalId);
        }
        log.info("Goal deleted: id={}, website_id={}", goalId, websiteId);
    }

    public FunnelReport getAnalytics(String websiteId, String goalId, String startDate, String endDate) {
        GoalDefinition goal = load(websiteId, goalId);
        DateRange range = rangeFor(goal, startDate, endDate);
        QueryContext context = range.toContext(websiteId);
        return analyticsService.analyzeGoal(goal.toStep(), goal.getFilters(), context,
                analyticsService.countWebsiteVisitors(context));
    }

    /**
     * Hedefler analyticsExecutor üzerinde paralel hesaplanır. Ortak aralığın ziyaretçi sayısı bir kez alınır;
     * ignore_historic_data olan hedefler kendi aralıklarının sayısını kullanır. Herhangi bir hedef hata verirse tüm istek başarısız olur.
     */
    public Map<String, FunnelReport> bulkAnalytics(String websiteId, BulkGoalAnalyticsRequest request) {
        List<GoalDefinition> goals = new LinkedHashSet<>(request.getGoalIds()).stream()
                .map(goalId -> load(websiteId, goalId))
                .toList();

        DateRange sharedRange = dateRangeResolver.resolve(request.getStartDate(), request.getEndDate());
        QueryContext sharedContext = sharedRange.toContext(websiteId);
        boolean needsSharedBaseline = goals.stream().anyMatch(goal -> !goal.isIgnoreHistoricData());
        long sharedBaseline = needsSharedBaseline ? analyticsService.countWebsiteVisitors(sharedContext) : 0L;

        Map<String, Future<FunnelReport>> futures = new LinkedHashMap<>();
        try {
            for (GoalDefinition goal : goals) {
                futures.put(goal.getId(), analyticsExecutor.submit(
                        () -> analyzeInBulk(goal, request, sharedContext, sharedBaseline)));
            }
        } catch (RejectedExecutionException e) {
            cancelAll(futures.values());
            log.error("Bulk goal analytics rejected: website_id={}, submitted={}/{}",
                    websiteId, futures.size(), goals.size());
            throw failure("Bulk goal analytics rejected: executor saturated", e);
        }

        Map<String, FunnelReport> reports = await(futures);
        log.info("Bulk goal analytics: website_id={}, goals={}", websiteId, reports.size());
        return reports;
    }

    private FunnelReport analyzeInBulk(GoalDefinition goal, BulkGoalAnalyticsRequest request,
                                       QueryContext sharedContext, long sharedBaseline) {
        if (!goal.isIgnoreHistoricData()) {
            return analyticsService.analyzeGoal(goal.toStep(), goal.getFilters(), sharedContext,
                    sharedBaseline);
        }
        QueryContext context = rangeFor(goal, request.getStartDate(), request.getEndDate())
                .toContext(goal.getWebsiteId());
        return analyticsService.analyzeGoal(goal.toStep(), goal.getFilters(), context,
                analyticsService.countWebsiteVisitors(context));
    }

    /** Tüm hedefler tek bir süre sınırı altında beklenir; hata veya zaman aşımında kalan görevler kesilir. */
    private Map<String, FunnelReport> await(Map<String, Future<FunnelReport>> futures) {
        long timeoutSeconds = appProperties.getAnalytics().getBulkTimeoutSeconds();
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(timeoutSeconds);
        Map<String, FunnelReport> reports = new LinkedHashMap<>();
        try {
            for (Map.Entry<String, Future<FunnelReport>> entry : futures.entrySet()) {
                long remaining = Math.max(0L, deadline - System.nanoTime());
                reports.put(entry.getKey(), entry.getValue().get(remaining, TimeUnit.NANOSECONDS));
            }
            return reports;
        } catch (ExecutionException e) {
            cancelAll(futures.values());
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            throw failure("Bulk goal analytics failed: " + cause.getMessage(), cause);
        } catch (TimeoutException e) {
            cancelAll(futures.values());
            log.error("Bulk goal analytics timed out after {}s", timeoutSeconds);
            throw failure("Bulk goal analytics timed out after " + timeoutSeconds + "s", e);
        } catch (InterruptedException e) {
            cancelAll(futures.values());
            Thread.currentThread().interrupt();
            throw failure("Bulk goal analytics interrupted", e);
        }
    }

    private static void cancelAll(Collection<Future<FunnelReport>> futures) {
        futures.forEach(future -> future.cancel(true));
    }

    private DateRange rangeFor(GoalDefinition goal, String startDate, String endDate) {
        return dateRangeResolver.resolve(startDate, endDate, goal.getCreatedAt(), goal.isIgnoreHistoricData());
    }

    private GoalDefinition load(String websiteId, String goalId) {
        return goalRepository.findById(websiteId, goalId)
                .orElseThrow(() -> notFound(goalId));
    }

    private QueryFailedException failure(String message, Throwable cause) {
        return new QueryFailedException(message, cause, appProperties.getAnalytics().getRetryAfterSeconds());
    }

    private static NotFoundException notFound(String goalId) {
        return new NotFoundException("Goal not found: " + goalId);
    }
}
