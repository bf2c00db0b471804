package com.baykanat.funnel.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/** Kısmi güncelleme; null alanlar değişmez. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Partial funnel update; omitted fields are left unchanged")
public class FunnelUpdateRequest {

    @Size(min = 1, max = 100, message = "name must be between 1 and 100 characters")
    @JsonProperty("name")
    private String name;

    @JsonProperty("description")
    private String description;

    @Size(min = 2, max = 10, message = "a funnel must have between 2 and 10 steps")
    @JsonProperty("steps")
    private List<@Valid StepRequest> steps;

    @JsonProperty("filters")
    private List<@Valid FilterRequest> filters;

    @JsonProperty("ignore_historic_data")
    private Boolean ignoreHistoricData;

    @JsonProperty("is_active")
    private Boolean active;
}
