package com.baykanat.funnel.api.controller;

import com.baykanat.funnel.api.dto.FunnelReport;
import com.baykanat.funnel.api.dto.FunnelResponse;
import com.baykanat.funnel.api.dto.ReferrerAnalyticsResponse;
import com.baykanat.funnel.api.dto.ReferrerSegment;
import com.baykanat.funnel.domain.exception.InvalidArgumentException;
import com.baykanat.funnel.domain.exception.NotFoundException;
import com.baykanat.funnel.domain.exception.QueryFailedException;
import com.baykanat.funnel.domain.model.ParsedReferrer;
import com.baykanat.funnel.domain.service.FunnelService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Web layer tests for FunnelController.
 *
 * <p>FunnelService is mocked. These tests verify:
 * <ul>
 *   <li>Request validation (400 on invalid funnel payloads)</li>
 *   <li>Report field names in the JSON contract</li>
 *   <li>Error mapping: 404, 400 and 503 with Retry-After</li>
 * </ul>
 */
@WebMvcTest(FunnelController.class)
class FunnelControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockitoBean
    private FunnelService funnelService;

    @Test
    @DisplayName("POST /funnels - valid funnel returns 201")
    void createFunnelReturns201() throws Exception {
        when(funnelService.create(eq("site-1"), any())).thenReturn(FunnelResponse.builder()
                .id("f1")
                .websiteId("site-1")
                .name("Signup")
                .active(true)
                .build());

        mockMvc.perform(post("/websites/site-1/funnels")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of(
                                "name", "Signup",
                                "steps", List.of(
                                        Map.of("type", "PAGE_VIEW", "target", "/", "name", "Landing"),
                                        Map.of("type", "EVENT", "target", "signup", "name", "Signup"))))))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value("f1"))
                .andExpect(jsonPath("$.website_id").value("site-1"))
                .andExpect(jsonPath("$.is_active").value(true));
    }

    @Test
    @DisplayName("POST /funnels - single step returns 400")
    void singleStepFunnelReturns400() throws Exception {
        mockMvc.perform(post("/websites/site-1/funnels")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of(
                                "name", "Too short",
                                "steps", List.of(Map.of("type", "PAGE_VIEW", "target", "/", "name", "Landing"))))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Validation failed"))
                .andExpect(jsonPath("$.details[0].field").value("steps"));

        verifyNoInteractions(funnelService);
    }

    @Test
    @DisplayName("POST /funnels - unknown step type returns 400")
    void unknownStepTypeReturns400() throws Exception {
        mockMvc.perform(post("/websites/site-1/funnels")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"name": "x", "steps": [
                                  {"type": "CLICK", "target": "/", "name": "a"},
                                  {"type": "EVENT", "target": "b", "name": "b"}]}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Malformed request body"));
    }

    @Test
    @DisplayName("GET /funnels/{id}/analytics - report uses snake_case contract")
    void analyticsReturnsReport() throws Exception {
        when(funnelService.getAnalytics("site-1", "f1", "2026-01-01", "2026-01-31")).thenReturn(FunnelReport.builder()
                .overallConversionRate(50.0)
                .totalUsersEntered(2)
                .totalUsersCompleted(1)
                .avgCompletionTime(20.0)
                .avgCompletionTimeFormatted("20s")
                .biggestDropoffStep(2)
                .biggestDropoffRate(50.0)
                .stepsAnalytics(List.of(FunnelReport.StepMetrics.builder()
                        .stepNumber(1).stepName("Landing").users(2).totalUsers(2).conversionRate(100.0).build()))
                .build());

        mockMvc.perform(get("/websites/site-1/funnels/f1/analytics")
                        .param("start_date", "2026-01-01")
                        .param("end_date", "2026-01-31"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.overall_conversion_rate").value(50.0))
                .andExpect(jsonPath("$.total_users_entered").value(2))
                .andExpect(jsonPath("$.avg_completion_time_formatted").value("20s"))
                .andExpect(jsonPath("$.biggest_dropoff_step").value(2))
                .andExpect(jsonPath("$.steps_analytics[0].step_name").value("Landing"))
                .andExpect(jsonPath("$.steps_analytics[0].conversion_rate").value(100.0));
    }

    @Test
    @DisplayName("GET /funnels/{id}/analytics/referrers - segments with parsed referrer")
    void referrerAnalytics() throws Exception {
        when(funnelService.getAnalyticsByReferrer(eq("site-1"), eq("f1"), isNull(), isNull()))
                .thenReturn(ReferrerAnalyticsResponse.builder()
                        .referrerAnalytics(List.of(ReferrerSegment.builder()
                                .referrer("google.com")
                                .referrerParsed(ParsedReferrer.builder()
                                        .name("Google").type("search").domain("google.com").url("https://google.com/")
                                        .build())
                                .totalUsers(2)
                                .completedUsers(1)
                                .conversionRate(50.0)
                                .build()))
                        .build());

        mockMvc.perform(get("/websites/site-1/funnels/f1/analytics/referrers"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.referrer_analytics[0].referrer").value("google.com"))
                .andExpect(jsonPath("$.referrer_analytics[0].referrer_parsed.name").value("Google"))
                .andExpect(jsonPath("$.referrer_analytics[0].total_users").value(2))
                .andExpect(jsonPath("$.referrer_analytics[0].completed_users").value(1))
                .andExpect(jsonPath("$.referrer_analytics[0].conversion_rate").value(50.0));
    }

    @Test
    @DisplayName("Unknown funnel - 404")
    void unknownFunnelReturns404() throws Exception {
        doThrow(new NotFoundException("Funnel not found: nope")).when(funnelService).delete("site-1", "nope");

        mockMvc.perform(delete("/websites/site-1/funnels/nope"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Funnel not found: nope"));
    }

    @Test
    @DisplayName("Invalid date range - 400")
    void invalidDatesReturn400() throws Exception {
        when(funnelService.getAnalytics("site-1", "f1", "2026-02-01", "2026-01-01"))
                .thenThrow(new InvalidArgumentException("start_date 2026-02-01 is after end_date 2026-01-01"));

        mockMvc.perform(get("/websites/site-1/funnels/f1/analytics")
                        .param("start_date", "2026-02-01")
                        .param("end_date", "2026-01-01"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value(400));
    }

    @Test
    @DisplayName("Event store down - 503 with Retry-After")
    void storeFailureReturns503() throws Exception {
        when(funnelService.getAnalytics(eq("site-1"), eq("f1"), any(), any()))
                .thenThrow(new QueryFailedException("Event store is temporarily unavailable. Circuit breaker is open.", null, 30));

        mockMvc.perform(get("/websites/site-1/funnels/f1/analytics"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(header().string("Retry-After", "30"));
    }

    @Test
    @DisplayName("POST /funnels/analytics - empty steps returns 400")
    void adHocEmptyStepsReturns400() throws Exception {
        mockMvc.perform(post("/websites/site-1/funnels/analytics")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"steps\": []}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(funnelService);
    }
}
