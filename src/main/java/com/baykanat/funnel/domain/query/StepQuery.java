package com.baykanat.funnel.domain.query;

import lombok.Value;

/** Tek adım için (step_number, step_name, visitor_id, occurred_at[, referrer]) dönen SELECT. */
@Value
public class StepQuery {

    int stepNumber;
    String sql;
}
