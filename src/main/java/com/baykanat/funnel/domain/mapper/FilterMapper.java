package com.baykanat.funnel.domain.mapper;

import com.baykanat.funnel.api.dto.FilterRequest;
import com.baykanat.funnel.domain.model.Filter;
import org.mapstruct.Mapper;

import java.util.List;

/** FilterRequest → Filter. */
@Mapper(componentModel = "spring")
public interface FilterMapper {

    Filter toFilter(FilterRequest request);

    List<Filter> toFilters(List<FilterRequest> requests);
}
