package com.baykanat.funnel.domain.model;

import lombok.Value;

/** Çözümlenmiş tarih aralığı; end günün sonunu kapsayacak şekilde biçimlenmiştir. */
@Value
public class DateRange {

    String startDate;
    String endDate;

    public QueryContext toContext(String websiteId) {
        return QueryContext.builder()
                .websiteId(websiteId)
                .startDate(startDate)
                .endDate(endDate)
                .build();
    }
}
