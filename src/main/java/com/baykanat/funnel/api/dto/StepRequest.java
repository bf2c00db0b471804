package com.baykanat.funnel.api.dto;

import com.baykanat.funnel.domain.model.StepKind;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Funnel adımı; step_number verilmezse listedeki sıradan atanır. Yanıtlarda da aynı şekil kullanılır. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Funnel step: a page view matched by path or a named event")
public class StepRequest {

    @JsonProperty("step_number")
    @Positive(message = "step_number must be positive")
    @Schema(description = "1-based position; defaults to the list position", example = "1")
    private Integer stepNumber;

    @NotNull(message = "type is required")
    @JsonProperty("type")
    @Schema(description = "Step kind", example = "PAGE_VIEW")
    private StepKind type;

    @NotBlank(message = "target is required")
    @JsonProperty("target")
    @Schema(description = "Path for PAGE_VIEW, event name for EVENT", example = "/pricing")
    private String target;

    @NotBlank(message = "name is required")
    @JsonProperty("name")
    @Schema(description = "Display name of the step", example = "Viewed pricing")
    private String name;
}
