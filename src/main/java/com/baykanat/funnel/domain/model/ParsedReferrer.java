package com.baykanat.funnel.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

/** Referrer string'inin çözümlenmiş hali. */
@Value
@Builder
@Schema(description = "Parsed referrer source")
public class ParsedReferrer {

    public static final String TYPE_DIRECT = "direct";
    public static final String TYPE_REFERRER = "referrer";

    @JsonProperty("name")
    @Schema(description = "Display name", example = "Google")
    String name;

    @JsonProperty("type")
    @Schema(description = "Source type (direct, search, social, email, referrer)", example = "search")
    String type;

    @JsonProperty("domain")
    @Schema(description = "Normalized host without www.", example = "google.com")
    String domain;

    @JsonProperty("url")
    @Schema(description = "Raw referrer value", example = "https://www.google.com/search?q=analytics")
    String url;

    public static ParsedReferrer direct() {
        return new ParsedReferrer("Direct", TYPE_DIRECT, "", "");
    }
}
