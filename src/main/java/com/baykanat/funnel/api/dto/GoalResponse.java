package com.baykanat.funnel.api.dto;

import com.baykanat.funnel.domain.model.Filter;
import com.baykanat.funnel.domain.model.StepKind;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Stored goal definition")
public class GoalResponse {

    @JsonProperty("id")
    private String id;

    @JsonProperty("website_id")
    private String websiteId;

    @JsonProperty("name")
    private String name;

    @JsonProperty("type")
    private StepKind type;

    @JsonProperty("target")
    private String target;

    @JsonProperty("description")
    private String description;

    @JsonProperty("filters")
    private List<Filter> filters;

    @JsonProperty("ignore_historic_data")
    private boolean ignoreHistoricData;

    @JsonProperty("is_active")
    private boolean active;

    @JsonProperty("created_at")
    private Instant createdAt;

    @JsonProperty("updated_at")
    private Instant updatedAt;
}
