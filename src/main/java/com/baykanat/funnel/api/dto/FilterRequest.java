package com.baykanat.funnel.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Event filtresi; alan ve operatör allowlist'i sorgu derlenirken uygulanır. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Filter applied to page-view and event rows")
public class FilterRequest {

    @NotBlank(message = "field is required")
    @JsonProperty("field")
    @Schema(description = "Event column", example = "country")
    private String field;

    @NotBlank(message = "operator is required")
    @JsonProperty("operator")
    @Schema(description = "Comparison operator", example = "in")
    private String operator;

    @JsonProperty("value")
    @Schema(description = "Single value or list of values; omitted for is_null / is_not_null", example = "[\"TR\", \"DE\"]")
    private Object value;
}
