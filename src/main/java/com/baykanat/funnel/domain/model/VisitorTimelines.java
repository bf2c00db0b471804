package com.baykanat.funnel.domain.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** visitor_id → zamana göre sıralı adım event'leri. Oluşturulduktan sonra salt okunur. */
public final class VisitorTimelines {

    private final Map<String, List<StepEvent>> byVisitor;

    public VisitorTimelines(Map<String, List<StepEvent>> byVisitor) {
        Map<String, List<StepEvent>> copy = new LinkedHashMap<>();
        byVisitor.forEach((visitorId, timeline) -> copy.put(visitorId, List.copyOf(timeline)));
        this.byVisitor = Collections.unmodifiableMap(copy);
    }

    public static VisitorTimelines empty() {
        return new VisitorTimelines(Map.of());
    }

    public Map<String, List<StepEvent>> asMap() {
        return byVisitor;
    }

    public Set<String> visitorIds() {
        return byVisitor.keySet();
    }

    public List<StepEvent> timeline(String visitorId) {
        return byVisitor.getOrDefault(visitorId, List.of());
    }

    public int size() {
        return byVisitor.size();
    }

    /** Sadece verilen ziyaretçileri içeren görünüm; sıralama korunur. */
    public VisitorTimelines restrictTo(Collection<String> visitorIds) {
        Map<String, List<StepEvent>> subset = new LinkedHashMap<>();
        for (String visitorId : visitorIds) {
            List<StepEvent> timeline = byVisitor.get(visitorId);
            if (timeline != null) {
                subset.put(visitorId, timeline);
            }
        }
        return new VisitorTimelines(subset);
    }
}
