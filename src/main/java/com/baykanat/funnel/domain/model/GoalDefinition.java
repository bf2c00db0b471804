package com.baykanat.funnel.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/** goals tablosu satırı; tek adımlı hedef (page view veya event). */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GoalDefinition {

    private String id;
    private String websiteId;
    private String name;
    private StepKind type;
    private String target;
    private String description;
    private List<Filter> filters;
    private boolean ignoreHistoricData;
    private boolean active;
    private Instant createdAt;
    private Instant updatedAt;

    /** Hedefi tek adımlı funnel olarak döner. */
    public FunnelStep toStep() {
        return FunnelStep.builder()
                .stepNumber(1)
                .name(name)
                .kind(type)
                .target(target)
                .build();
    }
}
