package com.baykanat.funnel.domain.mapper;

import com.baykanat.funnel.api.dto.GoalRequest;
import com.baykanat.funnel.api.dto.GoalResponse;
import com.baykanat.funnel.api.dto.GoalUpdateRequest;
import com.baykanat.funnel.domain.model.GoalDefinition;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

@Mapper(componentModel = "spring", uses = FilterMapper.class)
public interface GoalMapper {

    @Mapping(target = "id", ignore = true)
    @Mapping(target = "websiteId", ignore = true)
    @Mapping(target = "createdAt", ignore = true)
    @Mapping(target = "updatedAt", ignore = true)
    @Mapping(target = "active", source = "active", defaultValue = "true")
    @Mapping(target = "ignoreHistoricData", source = "ignoreHistoricData", defaultValue = "false")
    GoalDefinition toDefinition(GoalRequest request);

    GoalResponse toResponse(GoalDefinition definition);

    /** Null alanlar değişmez. */
    default void applyUpdate(GoalUpdateRequest update, FilterMapper filterMapper, GoalDefinition definition) {
        if (update.getName() != null) {
            definition.setName(update.getName());
        }
        if (update.getType() != null) {
            definition.setType(update.getType());
        }
        if (update.getTarget() != null) {
            definition.setTarget(update.getTarget());
        }
        if (update.getDescription() != null) {
            definition.setDescription(update.getDescription());
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
}
