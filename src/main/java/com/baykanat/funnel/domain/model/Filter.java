package com.baykanat.funnel.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Collection;
import java.util.List;

/** (field, operator, value) filtresi; value tek string ya da string listesi olabilir. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Filter {

    private String field;
    private String operator;
    private Object value;

    @JsonIgnore
    public boolean isMultiValued() {
        return value instanceof Collection<?>;
    }

    /** Liste değerini string listesine çevirir; tek değer tek elemanlı liste olur. */
    @JsonIgnore
    public List<String> getValues() {
        if (value == null) {
            return List.of();
        }
        if (value instanceof Collection<?> collection) {
            return collection.stream().map(String::valueOf).toList();
        }
        return List.of(String.valueOf(value));
    }

    @JsonIgnore
    public String getSingleValue() {
        return value == null || isMultiValued() ? null : String.valueOf(value);
    }
}
