package com.baykanat.funnel.domain.model;

/** Funnel adımı türü: PAGE_VIEW path ile, EVENT event adıyla eşleşir. */
public enum StepKind {
    PAGE_VIEW,
    EVENT
}
