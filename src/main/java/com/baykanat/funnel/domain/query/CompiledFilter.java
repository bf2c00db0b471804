package com.baykanat.funnel.domain.query;

import lombok.Value;

import java.util.List;

/** Derlenmiş filtre: " AND ..." ile başlayan predicate (filtre yoksa boş) ve atlanan filtrelerin nedenleri. */
@Value
public class CompiledFilter {

    public static final CompiledFilter EMPTY = new CompiledFilter("", List.of());

    String predicate;
    List<String> rejected;
}
