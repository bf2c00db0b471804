package com.baykanat.funnel.domain.service;

import com.baykanat.funnel.config.AppProperties;
import com.baykanat.funnel.domain.exception.InvalidArgumentException;
import com.baykanat.funnel.domain.model.DateRange;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;

/**
 * İstek tarihlerini store'a gidecek aralığa çevirir.
 * Eksik sınırda son default-range-days gün (UTC); ignore_historic_data ise başlangıç tanımın oluşturulma gününden önce olamaz.
 */
@Component
@RequiredArgsConstructor
public class DateRangeResolver {

    private final AppProperties appProperties;
    private final Clock clock;

    public DateRange resolve(String startDate, String endDate) {
        return resolve(startDate, endDate, null, false);
    }

    public DateRange resolve(String startDate, String endDate, Instant createdAt, boolean ignoreHistoricData) {
        LocalDate start;
        LocalDate end;
        if (isBlank(startDate) || isBlank(endDate)) {
            end = LocalDate.now(clock);
            start = end.minusDays(appProperties.getAnalytics().getDefaultRangeDays());
        } else {
            start = parse("start_date", startDate);
            end = parse("end_date", endDate);
        }

        if (start.isAfter(end)) {
            throw new InvalidArgumentException("start_date " + start + " is after end_date " + end);
        }

        if (ignoreHistoricData && createdAt != null) {
            LocalDate createdDate = createdAt.atOffset(ZoneOffset.UTC).toLocalDate();
            if (createdDate.isAfter(start)) {
                // tanım aralıktan sonra oluşturulmuşsa yalnızca son gün sorgulanır
                start = createdDate.isAfter(end) ? end : createdDate;
            }
        }
        return new DateRange(start.toString(), end + appProperties.getAnalytics().getEndOfDaySuffix());
    }

    private static LocalDate parse(String name, String value) {
        try {
            return LocalDate.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new InvalidArgumentException(name + " must be in yyyy-MM-dd format: " + value);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
