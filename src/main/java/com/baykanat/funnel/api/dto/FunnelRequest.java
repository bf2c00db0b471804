package com.baykanat.funnel.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/** Funnel oluşturma gövdesi. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Funnel definition payload")
public class FunnelRequest {

    @NotBlank(message = "name is required")
    @Size(max = 100, message = "name must be at most 100 characters")
    @JsonProperty("name")
    @Schema(description = "Funnel name", example = "Signup funnel")
    private String name;

    @JsonProperty("description")
    @Schema(description = "Optional description")
    private String description;

    @NotNull(message = "steps is required")
    @Size(min = 2, max = 10, message = "a funnel must have between 2 and 10 steps")
    @JsonProperty("steps")
    private List<@Valid StepRequest> steps;

    @JsonProperty("filters")
    private List<@Valid FilterRequest> filters;

    @JsonProperty("ignore_historic_data")
    @Schema(description = "Only count events after the funnel was created", example = "false")
    private Boolean ignoreHistoricData;

    @JsonProperty("is_active")
    @Schema(description = "Active flag, defaults to true", example = "true")
    private Boolean active;
}
