package com.baykanat.funnel.domain.model;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/** Filtrelenebilir events kolonları (allowlist). */
public enum FilterField {

    EVENT_NAME("event_name"),
    PATH("path"),
    REFERRER("referrer"),
    USER_AGENT("user_agent"),
    IP_ADDRESS("ip_address"),
    COUNTRY("country"),
    CITY("city"),
    DEVICE_TYPE("device_type"),
    BROWSER("browser"),
    BROWSER_NAME("browser_name"),
    OS("os"),
    OS_NAME("os_name"),
    SCREEN_RESOLUTION("screen_resolution"),
    LANGUAGE("language"),
    UTM_SOURCE("utm_source"),
    UTM_MEDIUM("utm_medium"),
    UTM_CAMPAIGN("utm_campaign"),
    UTM_TERM("utm_term"),
    UTM_CONTENT("utm_content");

    private static final Map<String, FilterField> BY_COLUMN = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(FilterField::getColumn, Function.identity()));

    private final String column;

    FilterField(String column) {
        this.column = column;
    }

    public String getColumn() {
        return column;
    }

    public static Optional<FilterField> fromColumn(String column) {
        return column == null ? Optional.empty() : Optional.ofNullable(BY_COLUMN.get(column));
    }
}
