package com.baykanat.funnel.domain.query;

import com.baykanat.funnel.config.AppProperties;
import com.baykanat.funnel.domain.exception.InvalidArgumentException;
import com.baykanat.funnel.domain.model.Filter;
import com.baykanat.funnel.domain.model.FilterField;
import com.baykanat.funnel.domain.model.FilterOperator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * (field, operator, value) filtrelerini named parametreli SQL predicate'ine derler.
 * Parametre adları filtre sırasıyla nitelenir (f0_path, f1_country ...), aynı funnel'ın tüm adım sorgularında paylaşılır.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FilterCompiler {

    private static final String PARAM_PREFIX = "f";

    private final AppProperties appProperties;

    /** Geçerli filtreleri AND ile birleştirir; geçersizler ayara göre atlanır ya da InvalidArgumentException fırlatılır. */
    public CompiledFilter compile(List<Filter> filters, String alias, Map<String, Object> params) {
        if (filters == null || filters.isEmpty()) {
            return CompiledFilter.EMPTY;
        }

        List<String> conditions = new ArrayList<>();
        List<String> rejected = new ArrayList<>();

        for (int i = 0; i < filters.size(); i++) {
            Filter filter = filters.get(i);
            String error = validate(filter);
            if (error != null) {
                rejected.add(error);
                continue;
            }
            FilterField field = FilterField.fromColumn(filter.getField()).orElseThrow();
            FilterOperator operator = FilterOperator.fromName(filter.getOperator()).orElseThrow();
            conditions.add(buildCondition(field, operator, filter, i, alias, params));
        }

        if (!rejected.isEmpty()) {
            if (appProperties.getFunnel().isRejectInvalidFilters()) {
                throw new InvalidArgumentException("Invalid filters: " + String.join(", ", rejected));
            }
            log.warn("Dropping {} invalid filter(s): {}", rejected.size(), rejected);
        }

        String predicate = conditions.isEmpty() ? "" : " AND " + String.join(" AND ", conditions);
        return new CompiledFilter(predicate, List.copyOf(rejected));
    }

    /** Hata mesajı döner; filtre geçerliyse null. */
    private String validate(Filter filter) {
        if (filter == null) {
            return "Filter must not be null";
        }
        if (FilterField.fromColumn(filter.getField()).isEmpty()) {
            return "Invalid field: " + filter.getField();
        }
        Optional<FilterOperator> operator = FilterOperator.fromName(filter.getOperator());
        if (operator.isEmpty()) {
            return "Invalid operator: " + filter.getOperator();
        }
        if (!operator.get().requiresValue()) {
            return null;
        }
        if (filter.isMultiValued()) {
            if (!operator.get().isListOperator()) {
                return "List value not supported for operator: " + filter.getOperator();
            }
            if (filter.getValues().isEmpty()) {
                return "Value is required for operator: " + filter.getOperator();
            }
            return null;
        }
        String value = filter.getSingleValue();
        if (value == null || value.isEmpty()) {
            return "Value is required for operator: " + filter.getOperator();
        }
        return null;
    }

    private String buildCondition(FilterField field, FilterOperator operator, Filter filter, int index,
                                  String alias, Map<String, Object> params) {
        String column = qualify(alias, field.getColumn());
        String paramKey = PARAM_PREFIX + index + "_" + field.getColumn();

        if (operator.isListOperator()) {
            params.put(paramKey, filter.getValues());
            String keyword = operator == FilterOperator.IN ? " IN " : " NOT IN ";
            return column + keyword + "(:" + paramKey + ")";
        }

        String value = filter.getSingleValue();
        return switch (operator) {
            case IS_NULL -> column + " IS NULL";
            case IS_NOT_NULL -> column + " IS NOT NULL";
            case EQUALS -> bind(params, paramKey, value, column + " = :" + paramKey);
            case NOT_EQUALS -> bind(params, paramKey, value, column + " <> :" + paramKey);
            case CONTAINS -> bind(params, paramKey, "%" + escapeLikeWildcards(value) + "%", column + " LIKE :" + paramKey);
            case NOT_CONTAINS -> bind(params, paramKey, "%" + escapeLikeWildcards(value) + "%", column + " NOT LIKE :" + paramKey);
            case STARTS_WITH -> bind(params, paramKey, escapeLikeWildcards(value) + "%", column + " LIKE :" + paramKey);
            case ENDS_WITH -> bind(params, paramKey, "%" + escapeLikeWildcards(value), column + " LIKE :" + paramKey);
            case GREATER_THAN -> bind(params, paramKey, value, column + " > :" + paramKey);
            case LESS_THAN -> bind(params, paramKey, value, column + " < :" + paramKey);
            case GREATER_THAN_OR_EQUAL -> bind(params, paramKey, value, column + " >= :" + paramKey);
            case LESS_THAN_OR_EQUAL -> bind(params, paramKey, value, column + " <= :" + paramKey);
            case IN, NOT_IN -> throw new IllegalStateException("List operator handled above: " + operator);
        };
    }

    private static String bind(Map<String, Object> params, String key, Object value, String condition) {
        params.put(key, value);
        return condition;
    }

    private static String qualify(String alias, String column) {
        return alias == null || alias.isBlank() ? column : alias + "." + column;
    }

    /** LIKE pattern'ine gömülecek değerde \, % ve _ karakterlerini kaçırır (varsayılan escape karakteri \). */
    public static String escapeLikeWildcards(String value) {
        return value.replace("\\", "\\\\")
                .replace("%", "\\%")
                .replace("_", "\\_");
    }
}
