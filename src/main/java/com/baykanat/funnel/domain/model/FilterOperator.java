package com.baykanat.funnel.domain.model;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/** İzin verilen filtre karşılaştırmaları (allowlist). */
public enum FilterOperator {

    EQUALS("equals"),
    NOT_EQUALS("not_equals"),
    CONTAINS("contains"),
    NOT_CONTAINS("not_contains"),
    STARTS_WITH("starts_with"),
    ENDS_WITH("ends_with"),
    IN("in"),
    NOT_IN("not_in"),
    IS_NULL("is_null"),
    IS_NOT_NULL("is_not_null"),
    GREATER_THAN("greater_than"),
    LESS_THAN("less_than"),
    GREATER_THAN_OR_EQUAL("greater_than_or_equal"),
    LESS_THAN_OR_EQUAL("less_than_or_equal");

    private static final Map<String, FilterOperator> BY_NAME = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(FilterOperator::getName, Function.identity()));

    private final String name;

    FilterOperator(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public boolean requiresValue() {
        return this != IS_NULL && this != IS_NOT_NULL;
    }

    public boolean isListOperator() {
        return this == IN || this == NOT_IN;
    }

    public static Optional<FilterOperator> fromName(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(BY_NAME.get(name));
    }
}
