package com.baykanat.funnel.domain.model;

import lombok.Builder;
import lombok.Value;

/** Analiz için tek funnel adımı; stepNumber 1'den başlar ve boşluksuz ilerler. */
@Value
@Builder
public class FunnelStep {

    int stepNumber;
    String name;
    StepKind kind;
    String target;
}
