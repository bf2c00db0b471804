package com.baykanat.funnel.domain.service;

import com.baykanat.funnel.api.dto.FunnelRequest;
import com.baykanat.funnel.api.dto.FunnelResponse;
import com.baykanat.funnel.config.AppProperties;
import com.baykanat.funnel.domain.exception.NotFoundException;
import com.baykanat.funnel.domain.mapper.FilterMapper;
import com.baykanat.funnel.domain.mapper.FunnelMapper;
import com.baykanat.funnel.domain.model.FunnelDefinition;
import com.baykanat.funnel.domain.model.FunnelStep;
import com.baykanat.funnel.domain.model.QueryContext;
import com.baykanat.funnel.domain.model.StepDefinition;
import com.baykanat.funnel.domain.model.StepKind;
import com.baykanat.funnel.infrastructure.persistence.FunnelDefinitionJdbcRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class FunnelServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-15T12:00:00Z");

    @Mock
    private FunnelDefinitionJdbcRepository funnelRepository;

    @Mock
    private FunnelMapper funnelMapper;

    @Mock
    private FilterMapper filterMapper;

    @Mock
    private FunnelAnalyticsService analyticsService;

    private FunnelService service;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        service = new FunnelService(funnelRepository, funnelMapper, filterMapper, analyticsService,
                new DateRangeResolver(new AppProperties(), clock), clock);
    }

    @Test
    @DisplayName("Create - assigns id, website and timestamps before insert")
    void createAssignsIdentity() {
        FunnelRequest request = FunnelRequest.builder().name("Signup").build();
        FunnelDefinition definition = FunnelDefinition.builder()
                .name("Signup")
                .steps(List.of(stepDefinition("/"), stepDefinition("/signup")))
                .active(true)
                .build();
        when(funnelMapper.toDefinition(request)).thenReturn(definition);
        when(funnelMapper.toResponse(any())).thenReturn(new FunnelResponse());

        service.create("site-1", request);

        ArgumentCaptor<FunnelDefinition> saved = ArgumentCaptor.forClass(FunnelDefinition.class);
        verify(funnelRepository).insert(saved.capture());
        assertThat(saved.getValue().getId()).isNotBlank();
        assertThat(saved.getValue().getWebsiteId()).isEqualTo("site-1");
        assertThat(saved.getValue().getCreatedAt()).isEqualTo(NOW);
        assertThat(saved.getValue().getUpdatedAt()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("Get / delete - unknown or deleted funnel is NotFound")
    void unknownFunnelIsNotFound() {
        when(funnelRepository.findById("site-1", "nope")).thenReturn(Optional.empty());
        when(funnelRepository.softDelete("site-1", "nope", NOW)).thenReturn(0);

        assertThatThrownBy(() -> service.get("site-1", "nope")).isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> service.delete("site-1", "nope")).isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> service.getAnalytics("site-1", "nope", null, null))
                .isInstanceOf(NotFoundException.class);
        verifyNoInteractions(analyticsService);
    }

    @Test
    @DisplayName("Analytics - stored steps and filters analyzed over the resolved range")
    void analyticsUsesResolvedRange() {
        FunnelDefinition definition = FunnelDefinition.builder()
                .id("f1")
                .websiteId("site-1")
                .steps(List.of(stepDefinition("/"), stepDefinition("/signup")))
                .filters(List.of())
                .ignoreHistoricData(true)
                .createdAt(Instant.parse("2026-01-15T09:00:00Z"))
                .build();
        List<FunnelStep> steps = List.of(
                FunnelStep.builder().stepNumber(1).name("/").kind(StepKind.PAGE_VIEW).target("/").build(),
                FunnelStep.builder().stepNumber(2).name("/signup").kind(StepKind.PAGE_VIEW).target("/signup").build());
        when(funnelRepository.findById("site-1", "f1")).thenReturn(Optional.of(definition));
        when(funnelMapper.toFunnelSteps(definition.getSteps())).thenReturn(steps);

        service.getAnalytics("site-1", "f1", "2026-01-01", "2026-01-31");

        ArgumentCaptor<QueryContext> context = ArgumentCaptor.forClass(QueryContext.class);
        verify(analyticsService).analyzeFunnel(eq(steps), anyList(), context.capture());
        assertThat(context.getValue().getWebsiteId()).isEqualTo("site-1");
        assertThat(context.getValue().getStartDate()).isEqualTo("2026-01-15");
        assertThat(context.getValue().getEndDate()).isEqualTo("2026-01-31 23:59:59");
    }

    private static StepDefinition stepDefinition(String path) {
        return StepDefinition.builder().type(StepKind.PAGE_VIEW).target(path).name(path).build();
    }
}
