package com.baykanat.funnel.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/** Birden çok hedefin aynı aralıkta analizi. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Bulk goal analytics request")
public class BulkGoalAnalyticsRequest {

    @NotEmpty(message = "goal_ids must not be empty")
    @Size(max = 50, message = "at most 50 goals per request")
    @JsonProperty("goal_ids")
    private List<String> goalIds;

    @JsonProperty("start_date")
    @Schema(example = "2026-01-01")
    private String startDate;

    @JsonProperty("end_date")
    @Schema(example = "2026-01-31")
    private String endDate;
}
