package com.baykanat.funnel.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** funnel_definitions.steps JSONB dizisinin bir elemanı; adım numarası dizideki sıradan gelir. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StepDefinition {

    private StepKind type;
    private String target;
    private String name;
}
