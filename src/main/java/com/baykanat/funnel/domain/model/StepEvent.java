package com.baykanat.funnel.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/** Store'dan dönen tek satır: bir ziyaretçinin bir adımla eşleşen event'i. referrer yalnızca atıf istendiğinde dolu. */
@Value
@Builder
public class StepEvent {

    int stepNumber;
    String stepName;
    String visitorId;
    Instant occurredAt;
    String referrer;
}
