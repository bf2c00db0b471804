package com.baykanat.funnel.api.dto;

import com.baykanat.funnel.domain.model.StepKind;
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

/** Hedef oluşturma gövdesi; hedef tek bir sayfa görüntüleme veya event'tir. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Goal definition payload")
public class GoalRequest {

    @NotBlank(message = "name is required")
    @Size(max = 100, message = "name must be at most 100 characters")
    @JsonProperty("name")
    @Schema(description = "Goal name", example = "Completed checkout")
    private String name;

    @NotNull(message = "type is required")
    @JsonProperty("type")
    @Schema(description = "Goal kind", example = "EVENT")
    private StepKind type;

    @NotBlank(message = "target is required")
    @JsonProperty("target")
    @Schema(description = "Path for PAGE_VIEW, event name for EVENT", example = "purchase")
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
