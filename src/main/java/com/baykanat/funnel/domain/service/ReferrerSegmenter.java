package com.baykanat.funnel.domain.service;

import com.baykanat.funnel.api.dto.ReferrerSegment;
import com.baykanat.funnel.config.AppProperties;
import com.baykanat.funnel.domain.model.CompletionSets;
import com.baykanat.funnel.domain.model.ParsedReferrer;
import com.baykanat.funnel.domain.model.StepEvent;
import com.baykanat.funnel.domain.model.VisitorTimelines;
import com.baykanat.funnel.domain.referrer.ReferrerParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Ziyaretçileri ilk kronolojik event'lerindeki referrer'a göre gruplar ve her grup için eşleştirmeyi yeniden çalıştırır.
 * Gruplar yalnızca kendi ziyaretçi dilimlerini okur; paralel çalıştırma kilitsiz güvenlidir.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReferrerSegmenter {

    private static final Comparator<ReferrerSegment> BY_TOTAL_USERS_DESC =
            Comparator.comparingLong(ReferrerSegment::getTotalUsers).reversed()
                    .thenComparing(ReferrerSegment::getReferrer);

    private final FunnelMatcher funnelMatcher;
    private final ReferrerParser referrerParser;
    private final AppProperties appProperties;

    /** total_users azalan sırada segmentler; min-segment-users altındaki gruplar atılır. */
    public List<ReferrerSegment> segment(VisitorTimelines timelines, int stepCount) {
        Map<String, ReferrerGroup> groups = groupByFirstTouch(timelines);
        int minUsers = appProperties.getFunnel().getMinSegmentUsers();

        Stream<ReferrerGroup> stream = appProperties.getFunnel().isParallelSegments()
                ? groups.values().parallelStream()
                : groups.values().stream();

        List<ReferrerSegment> segments = stream
                .map(group -> evaluate(group, timelines, stepCount))
                .filter(segment -> segment.getTotalUsers() >= minUsers)
                .sorted(BY_TOTAL_USERS_DESC)
                .toList();

        log.debug("Referrer segmentation: {} visitors, {} groups, {} kept", timelines.size(), groups.size(), segments.size());
        return segments;
    }

    /** Anahtar ziyaretçinin tüm adımlar arasındaki en erken event'inin referrer'ı (1. adım olmak zorunda değil). */
    private Map<String, ReferrerGroup> groupByFirstTouch(VisitorTimelines timelines) {
        Map<String, ReferrerGroup> groups = new LinkedHashMap<>();
        for (Map.Entry<String, List<StepEvent>> entry : timelines.asMap().entrySet()) {
            if (entry.getValue().isEmpty()) {
                continue;
            }
            ParsedReferrer parsed = referrerParser.parse(entry.getValue().get(0).getReferrer());
            String key = referrerParser.groupKey(parsed);
            groups.computeIfAbsent(key, k -> new ReferrerGroup(k, parsed)).visitorIds.add(entry.getKey());
        }
        return groups;
    }

    private ReferrerSegment evaluate(ReferrerGroup group, VisitorTimelines timelines, int stepCount) {
        CompletionSets completions = funnelMatcher.matchAll(timelines.restrictTo(group.visitorIds), stepCount);
        long totalUsers = completions.users(1);
        long completedUsers = completions.users(stepCount);

        return ReferrerSegment.builder()
                .referrer(group.key)
                .referrerParsed(group.parsed)
                .totalUsers(totalUsers)
                .completedUsers(completedUsers)
                .conversionRate(MetricsAggregator.pct(completedUsers, totalUsers))
                .build();
    }

    private static final class ReferrerGroup {
        private final String key;
        private final ParsedReferrer parsed;
        private final Set<String> visitorIds = new LinkedHashSet<>();

        private ReferrerGroup(String key, ParsedReferrer parsed) {
            this.key = key;
            this.parsed = parsed;
        }
    }
}
