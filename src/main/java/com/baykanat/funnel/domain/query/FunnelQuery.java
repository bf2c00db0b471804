package com.baykanat.funnel.domain.query;

import lombok.Value;

import java.util.Map;

/** Tüm adımların UNION ALL ile birleştirildiği tek sorgu ve named parametreleri. */
@Value
public class FunnelQuery {

    String sql;
    Map<String, Object> params;
    boolean includeReferrer;
}
