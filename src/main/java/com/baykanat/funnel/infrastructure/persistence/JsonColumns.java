package com.baykanat.funnel.infrastructure.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/** JSONB kolonları için Jackson okuma/yazma; null liste boş dizi olarak yazılır. */
@Component
@RequiredArgsConstructor
public class JsonColumns {

    private final ObjectMapper objectMapper;

    public String write(List<?> values) {
        try {
            return objectMapper.writeValueAsString(values == null ? List.of() : values);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize JSONB column", e);
        }
    }

    public <T> List<T> read(String json, TypeReference<List<T>> type) {
        if (json == null || json.isBlank()) {
            return new ArrayList<>();
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt JSONB column: " + e.getOriginalMessage(), e);
        }
    }
}
