package com.baykanat.funnel.api.dto;

import com.baykanat.funnel.domain.model.ParsedReferrer;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Tek referrer grubu için funnel girişi, tamamlama ve dönüşüm. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Funnel conversion for one first-touch referrer group")
public class ReferrerSegment {

    @JsonProperty("referrer")
    @Schema(description = "Group key: referrer domain, 'direct', or the raw value", example = "google.com")
    private String referrer;

    @JsonProperty("referrer_parsed")
    @Schema(description = "Parsed referrer of the group")
    private ParsedReferrer referrerParsed;

    @JsonProperty("total_users")
    @Schema(description = "Group visitors who entered the funnel", example = "240")
    private long totalUsers;

    @JsonProperty("completed_users")
    @Schema(description = "Group visitors who completed the last step", example = "61")
    private long completedUsers;

    @JsonProperty("conversion_rate")
    @Schema(description = "completed_users / total_users as a percentage", example = "25.42")
    private double conversionRate;
}
