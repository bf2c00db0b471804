package com.baykanat.funnel.domain.model;

import lombok.Builder;
import lombok.Value;

/** Store'a aynen bind edilen sorgu bağlamı: website ve tarih aralığı. */
@Value
@Builder
public class QueryContext {

    String websiteId;
    String startDate;
    String endDate;
}
