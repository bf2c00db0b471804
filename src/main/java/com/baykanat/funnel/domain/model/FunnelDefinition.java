package com.baykanat.funnel.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/** funnel_definitions tablosu satırı (JDBC, JPA değil). steps ve filters JSONB. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FunnelDefinition {

    private String id;
    private String websiteId;
    private String name;
    private String description;
    private List<StepDefinition> steps;
    private List<Filter> filters;
    private boolean ignoreHistoricData;
    private boolean active;
    private Instant createdAt;
    private Instant updatedAt;
}
