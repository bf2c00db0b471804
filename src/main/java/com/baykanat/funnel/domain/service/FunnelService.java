package com.baykanat.funnel.domain.service;

import com.baykanat.funnel.api.dto.FunnelAnalyticsRequest;
import com.baykanat.funnel.api.dto.FunnelReport;
import com.baykanat.funnel.api.dto.FunnelRequest;
import com.baykanat.funnel.api.dto.FunnelResponse;
import com.baykanat.funnel.api.dto.FunnelUpdateRequest;
import com.baykanat.funnel.api.dto.ReferrerAnalyticsResponse;
import com.baykanat.funnel.domain.exception.NotFoundException;
import com.baykanat.funnel.domain.mapper.FilterMapper;
import com.baykanat.funnel.domain.mapper.FunnelMapper;
import com.baykanat.funnel.domain.model.DateRange;
import com.baykanat.funnel.domain.model.FunnelDefinition;
import com.baykanat.funnel.infrastructure.persistence.FunnelDefinitionJdbcRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/** Kayıtlı funnel'lar: CRUD ve tanım üzerinden analiz. */
@Slf4j
@Service
@RequiredArgsConstructor
public class FunnelService {

    private final FunnelDefinitionJdbcRepository funnelRepository;
    private final FunnelMapper funnelMapper;
    private final FilterMapper filterMapper;
    private final FunnelAnalyticsService analyticsService;
    private final DateRangeResolver dateRangeResolver;
    private final Clock clock;

    public List<FunnelResponse> list(String websiteId) {
        return funnelRepository.findByWebsite(websiteId).stream()
                .map(funnelMapper::toResponse)
                .toList();
    }

    public FunnelResponse get(String websiteId, String funnelId) {
        return funnelMapper.toResponse(load(websiteId, funnelId));
    }

    public FunnelResponse create(String websiteId, FunnelRequest request) {
        FunnelDefinition definition = funnelMapper.toDefinition(request);
        Instant now = Instant.now(clock);
        definition.setId(UUID.randomUUID().toString());
        definition.setWebsiteId(websiteId);
        definition.setCreatedAt(now);
        definition.setUpdatedAt(now);

        funnelRepository.insert(definition);
        log.info("Funnel created: id={}, website_id={}, steps={}", definition.getId(), websiteId,
                definition.getSteps().size());
        return funnelMapper.toResponse(definition);
    }

    public FunnelResponse update(String websiteId, String funnelId, FunnelUpdateRequest request) {
        FunnelDefinition definition = load(websiteId, funnelId);
        funnelMapper.applyUpdate(request, filterMapper, definition);
        definition.setUpdatedAt(Instant.now(clock));

        if (funnelRepository.update(definition) == 0) {
            throw notFound(funnelId);
        }
        log.info("Funnel updated: id={}, website_id={}", funnelId, websiteId);
        return funnelMapper.toResponse(definition);
    }

    /** Soft delete; silinmiş funnel sonraki tüm işlemlerde 404 verir. */
    public void delete(String websiteId, String funnelId) {
        if (funnelRepository.softDelete(websiteId, funnelId, Instant.now(clock)) == 0) {
            throw notFound(funnelId);
        }
        log.info("Funnel deleted: id={}, website_id={}", funnelId, websiteId);
    }

    public FunnelReport getAnalytics(String websiteId, String funnelId, String startDate, String endDate) {
        FunnelDefinition definition = load(websiteId, funnelId);
        DateRange range = dateRangeResolver.resolve(startDate, endDate,
                definition.getCreatedAt(), definition.isIgnoreHistoricData());
        return analyticsService.analyzeFunnel(funnelMapper.toFunnelSteps(definition.getSteps()),
                definition.getFilters(), range.toContext(websiteId));
    }

    public ReferrerAnalyticsResponse getAnalyticsByReferrer(String websiteId, String funnelId,
                                                            String startDate, String endDate) {
        FunnelDefinition definition = load(websiteId, funnelId);
        DateRange range = dateRangeResolver.resolve(startDate, endDate,
                definition.getCreatedAt(), definition.isIgnoreHistoricData());
        return analyticsService.analyzeByReferrer(funnelMapper.toFunnelSteps(definition.getSteps()),
                definition.getFilters(), range.toContext(websiteId));
    }

    /** Kaydedilmemiş funnel; adımlar ve filtreler istek gövdesinden. */
    public FunnelReport analyzeAdHoc(String websiteId, FunnelAnalyticsRequest request) {
        DateRange range = dateRangeResolver.resolve(request.getStartDate(), request.getEndDate());
        return analyticsService.analyzeFunnel(funnelMapper.requestsToFunnelSteps(request.getSteps()),
                filterMapper.toFilters(request.getFilters()), range.toContext(websiteId));
    }

    private FunnelDefinition load(String websiteId, String funnelId) {
        return funnelRepository.findById(websiteId, funnelId)
                .orElseThrow(() -> notFound(funnelId));
    }

    private static NotFoundException notFound(String funnelId) {
        return new NotFoundException("Funnel not found: " + funnelId);
    }
}
