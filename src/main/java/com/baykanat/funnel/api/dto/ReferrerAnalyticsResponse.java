package com.baykanat.funnel.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/** Referrer bazlı funnel yanıtı; gruplar total_users azalan sırada. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Funnel conversion segmented by first-touch referrer")
public class ReferrerAnalyticsResponse {

    @JsonProperty("referrer_analytics")
    @Schema(description = "Referrer groups sorted by total_users descending")
    private List<ReferrerSegment> referrerAnalytics;
}
