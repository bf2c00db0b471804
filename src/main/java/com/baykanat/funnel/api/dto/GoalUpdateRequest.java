package com.baykanat.funnel.api.dto;

import com.baykanat.funnel.domain.model.StepKind;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/** Kısmi hedef güncellemesi; null alanlar değişmez. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GoalUpdateRequest {

    @Size(min = 1, max = 100, message = "name must be between 1 and 100 characters")
    @JsonProperty("name")
    private String name;

    @JsonProperty("type")
    private StepKind type;

    @Size(min = 1, message = "target must not be empty")
    @JsonProperty("target")
    private String target;

    @JsonProperty("description")
    private String description;

    @JsonProperty("filters")
    private List<@Valid FilterRequest> filters;

    @JsonProperty("ignore_historic_data")
    private Boolean ignoreHistoricData;

    @JsonProperty("is_active")
    private Boolean active;
}
