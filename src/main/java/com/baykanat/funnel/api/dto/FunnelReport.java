package com.baykanat.funnel.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/** Funnel (veya hedef) raporu: adım metrikleri ve genel dönüşüm özeti. Alan adları dashboard sözleşmesidir. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Funnel conversion report")
public class FunnelReport {

    @JsonProperty("overall_conversion_rate")
    @Schema(description = "Percentage of entrants who completed the last step", example = "33.33")
    private double overallConversionRate;

    @JsonProperty("total_users_entered")
    @Schema(description = "Visitors who completed step 1 (goal: total site visitors)", example = "1200")
    private long totalUsersEntered;

    @JsonProperty("total_users_completed")
    @Schema(description = "Visitors who completed the last step", example = "400")
    private long totalUsersCompleted;

    @JsonProperty("avg_completion_time")
    @Schema(description = "Mean seconds from step 1 to the last step among completers", example = "754.5")
    private double avgCompletionTime;

    @JsonProperty("avg_completion_time_formatted")
    @Schema(description = "Human readable completion time", example = "12m 35s")
    private String avgCompletionTimeFormatted;

    @JsonProperty("biggest_dropoff_step")
    @Schema(description = "Step number with the highest dropoff rate", example = "2")
    private int biggestDropoffStep;

    @JsonProperty("biggest_dropoff_rate")
    @Schema(description = "Dropoff rate of that step", example = "48.5")
    private double biggestDropoffRate;

    @JsonProperty("steps_analytics")
    @Schema(description = "Per-step metrics in funnel order")
    private List<StepMetrics> stepsAnalytics;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @Schema(description = "Metrics for a single funnel step")
    public static class StepMetrics {

        @JsonProperty("step_number")
        @Schema(description = "1-based step number", example = "2")
        private int stepNumber;

        @JsonProperty("step_name")
        @Schema(description = "Step display name", example = "Signup")
        private String stepName;

        @JsonProperty("users")
        @Schema(description = "Visitors who reached this step in order", example = "620")
        private long users;

        @JsonProperty("total_users")
        @Schema(description = "Funnel entrants (goal: total site visitors)", example = "1200")
        private long totalUsers;

        @JsonProperty("conversion_rate")
        @Schema(description = "Percentage of the previous step's visitors who reached this step", example = "51.67")
        private double conversionRate;

        @JsonProperty("dropoffs")
        @Schema(description = "Previous step visitors who did not reach this step", example = "580")
        private long dropoffs;

        @JsonProperty("dropoff_rate")
        @Schema(description = "Dropoffs as a percentage of the previous step", example = "48.33")
        private double dropoffRate;

        @JsonProperty("avg_time_to_complete")
        @Schema(description = "Mean seconds from the previous step to this one", example = "95.25")
        private double avgTimeToComplete;
    }
}
