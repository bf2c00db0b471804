package com.baykanat.funnel.domain.mapper;

import com.baykanat.funnel.api.dto.FunnelRequest;
import com.baykanat.funnel.api.dto.FunnelResponse;
import com.baykanat.funnel.api.dto.FunnelUpdateRequest;
import com.baykanat.funnel.api.dto.StepRequest;
import com.baykanat.funnel.domain.model.FunnelDefinition;
import com.baykanat.funnel.domain.model.FunnelStep;
import com.baykanat.funnel.domain.model.StepDefinition;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

import java.util.ArrayList;
import java.util.List;

/** Funnel istek/yanıt DTO'ları ↔ FunnelDefinition ve tanım adımları → hesaplanabilir FunnelStep listesi. */
@Mapper(componentModel = "spring", uses = FilterMapper.class)
public interface FunnelMapper {

    /** is_active verilmezse true; id, website ve zaman damgaları serviste atanır. */
    @Mapping(target = "id", ignore = true)
    @Mapping(target = "websiteId", ignore = true)
    @Mapping(target = "createdAt", ignore = true)
    @Mapping(target = "updatedAt", ignore = true)
    @Mapping(target = "active", source = "active", defaultValue = "true")
    @Mapping(target = "ignoreHistoricData", source = "ignoreHistoricData", defaultValue = "false")
    FunnelDefinition toDefinition(FunnelRequest request);

    FunnelResponse toResponse(FunnelDefinition definition);

    StepDefinition toStepDefinition(StepRequest request);

    List<StepDefinition> toStepDefinitions(List<StepRequest> requests);

    /** Kısmi güncelleme; null alanlara dokunulmaz, listeler tamamen değiştirilir. */
    default void applyUpdate(FunnelUpdateRequest update, FilterMapper filterMapper, FunnelDefinition definition) {
        if (update.getName() != null) {
            definition.setName(update.getName());
        }
        if (update.getDescription() != null) {
            definition.setDescription(update.getDescription());
        }
        if (update.getSteps() != null) {
            definition.setSteps(toStepDefinitions(update.getSteps()));
        }
        if (update.getFilters() != null) {
            definition.setFilters(filterMapper.toFilters(update.getFilters()));
        }
        if (update.getIgnoreHistoricData() != null) {
            definition.setIgnoreHistoricData(update.getIgnoreHistoricData());
        }
        if (update.getActive() != null) {
            definition.setActive(update.getActive());
        }
    }

    /** Yanıttaki adımlar liste sırasıyla numaralanır. */
    default List<StepRequest> toStepViews(List<StepDefinition> steps) {
        if (steps == null) {
            return null;
        }
        List<StepRequest> views = new ArrayList<>(steps.size());
        for (int i = 0; i < steps.size(); i++) {
            StepDefinition step = steps.get(i);
            views.add(StepRequest.builder()
                    .stepNumber(i + 1)
                    .type(step.getType())
                    .target(step.getTarget())
                    .name(step.getName())
                    .build());
        }
        return views;
    }

    /** Kayıtlı adımlar için numara her zaman liste sırasıdır. */
    default List<FunnelStep> toFunnelSteps(List<StepDefinition> steps) {
        List<FunnelStep> result = new ArrayList<>();
        if (steps == null) {
            return result;
        }
        for (int i = 0; i < steps.size(); i++) {
            StepDefinition step = steps.get(i);
            result.add(FunnelStep.builder()
                    .stepNumber(i + 1)
                    .name(step.getName())
                    .kind(step.getType())
                    .target(step.getTarget())
                    .build());
        }
        return result;
    }

    /** Anlık analizde istemcinin verdiği step_number korunur; süreklilik analiz servisinde doğrulanır. */
    default List<FunnelStep> requestsToFunnelSteps(List<StepRequest> requests) {
        List<FunnelStep> result = new ArrayList<>();
        if (requests == null) {
            return result;
        }
        for (int i = 0; i < requests.size(); i++) {
            StepRequest request = requests.get(i);
            result.add(FunnelStep.builder()
                    .stepNumber(request.getStepNumber() != null ? request.getStepNumber() : i + 1)
                    .name(request.getName())
                    .kind(request.getType())
                    .target(request.getTarget())
                    .build());
        }
        return result;
    }
}
