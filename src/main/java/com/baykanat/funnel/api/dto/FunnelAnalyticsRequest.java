package com.baykanat.funnel.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/** Kaydedilmemiş funnel için anlık analiz isteği. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Ad-hoc funnel analysis request")
public class FunnelAnalyticsRequest {

    @NotEmpty(message = "steps must not be empty")
    @Size(max = 10, message = "a funnel can have at most 10 steps")
    @JsonProperty("steps")
    private List<@Valid StepRequest> steps;

    @JsonProperty("filters")
    private List<@Valid FilterRequest> filters;

    @JsonProperty("start_date")
    @Schema(description = "Inclusive start date (yyyy-MM-dd)", example = "2026-01-01")
    private String startDate;

    @JsonProperty("end_date")
    @Schema(description = "Inclusive end date (yyyy-MM-dd)", example = "2026-01-31")
    private String endDate;
}
