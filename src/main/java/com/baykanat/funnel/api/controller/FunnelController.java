package com.baykanat.funnel.api.controller;

import com.baykanat.funnel.api.dto.FunnelAnalyticsRequest;
import com.baykanat.funnel.api.dto.FunnelReport;
import com.baykanat.funnel.api.dto.FunnelRequest;
import com.baykanat.funnel.api.dto.FunnelResponse;
import com.baykanat.funnel.api.dto.FunnelUpdateRequest;
import com.baykanat.funnel.api.dto.ReferrerAnalyticsResponse;
import com.baykanat.funnel.domain.service.FunnelService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/** /websites/{websiteId}/funnels altında funnel CRUD ve analiz uçları. */
@Slf4j
@RestController
@RequestMapping("/websites/{websiteId}/funnels")
@RequiredArgsConstructor
@Validated
@Tag(name = "Funnels", description = "Funnel definitions and conversion analytics")
public class FunnelController {

    private final FunnelService funnelService;

    @GetMapping
    @Operation(summary = "List funnels", description = "Returns the website's funnels, newest first")
    public ResponseEntity<List<FunnelResponse>> listFunnels(@PathVariable("websiteId") String websiteId) {
        return ResponseEntity.ok(funnelService.list(websiteId));
    }

    @GetMapping("/{funnelId}")
    @Operation(summary = "Get a funnel")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Funnel found"),
            @ApiResponse(responseCode = "404", description = "Funnel not found or deleted")
    })
    public ResponseEntity<FunnelResponse> getFunnel(@PathVariable("websiteId") String websiteId,
                                                    @PathVariable("funnelId") String funnelId) {
        return ResponseEntity.ok(funnelService.get(websiteId, funnelId));
    }

    @PostMapping
    @Operation(summary = "Create a funnel", description = "Stores a funnel with 2 to 10 steps")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Funnel created"),
            @ApiResponse(responseCode = "400", description = "Invalid funnel definition")
    })
    public ResponseEntity<FunnelResponse> createFunnel(@PathVariable("websiteId") String websiteId,
                                                       @Valid @RequestBody FunnelRequest request) {
        log.debug("Creating funnel for website_id={} with {} steps", websiteId, request.getSteps().size());
        return ResponseEntity.status(HttpStatus.CREATED).body(funnelService.create(websiteId, request));
    }

    @PutMapping("/{funnelId}")
    @Operation(summary = "Update a funnel", description = "Partial update; omitted fields are unchanged")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Funnel updated"),
            @ApiResponse(responseCode = "400", description = "Invalid funnel definition"),
            @ApiResponse(responseCode = "404", description = "Funnel not found or deleted")
    })
    public ResponseEntity<FunnelResponse> updateFunnel(@PathVariable("websiteId") String websiteId,
                                                       @PathVariable("funnelId") String funnelId,
                                                       @Valid @RequestBody FunnelUpdateRequest request) {
        return ResponseEntity.ok(funnelService.update(websiteId, funnelId, request));
    }

    @DeleteMapping("/{funnelId}")
    @Operation(summary = "Delete a funnel", description = "Soft delete")
    @ApiResponses({
            @ApiResponse(responseCode = "204", description = "Funnel deleted"),
            @ApiResponse(responseCode = "404", description = "Funnel not found or already deleted")
    })
    public ResponseEntity<Void> deleteFunnel(@PathVariable("websiteId") String websiteId,
                                             @PathVariable("funnelId") String funnelId) {
        funnelService.delete(websiteId, funnelId);
        return ResponseEntity.noContent().build();
    }

    /** Tarih verilmezse son 30 gün. */
    @GetMapping("/{funnelId}/analytics")
    @Operation(summary = "Funnel analytics", description = "Per-step users, conversion, dropoff and timing")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Report computed"),
            @ApiResponse(responseCode = "400", description = "Invalid date range"),
            @ApiResponse(responseCode = "404", description = "Funnel not found"),
            @ApiResponse(responseCode = "503", description = "Event store unavailable")
    })
    public ResponseEntity<FunnelReport> getFunnelAnalytics(
            @PathVariable("websiteId") String websiteId,
            @PathVariable("funnelId") String funnelId,
            @Parameter(description = "Inclusive start date (yyyy-MM-dd)", example = "2026-01-01")
            @RequestParam(value = "start_date", required = false) String startDate,
            @Parameter(description = "Inclusive end date (yyyy-MM-dd)", example = "2026-01-31")
            @RequestParam(value = "end_date", required = false) String endDate) {
        return ResponseEntity.ok(funnelService.getAnalytics(websiteId, funnelId, startDate, endDate));
    }

    @GetMapping("/{funnelId}/analytics/referrers")
    @Operation(summary = "Funnel analytics by referrer",
            description = "Funnel conversion grouped by each visitor's first-touch referrer")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Segments computed"),
            @ApiResponse(responseCode = "404", description = "Funnel not found"),
            @ApiResponse(responseCode = "503", description = "Event store unavailable")
    })
    public ResponseEntity<ReferrerAnalyticsResponse> getReferrerAnalytics(
            @PathVariable("websiteId") String websiteId,
            @PathVariable("funnelId") String funnelId,
            @RequestParam(value = "start_date", required = false) String startDate,
            @RequestParam(value = "end_date", required = false) String endDate) {
        return ResponseEntity.ok(funnelService.getAnalyticsByReferrer(websiteId, funnelId, startDate, endDate));
    }

    @PostMapping("/analytics")
    @Operation(summary = "Ad-hoc funnel analytics", description = "Analyzes steps and filters given in the body without storing them")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Report computed"),
            @ApiResponse(responseCode = "400", description = "Invalid steps, filters or dates"),
            @ApiResponse(responseCode = "503", description = "Event store unavailable")
    })
    public ResponseEntity<FunnelReport> analyzeFunnel(@PathVariable("websiteId") String websiteId,
                                                      @Valid @RequestBody FunnelAnalyticsRequest request) {
        return ResponseEntity.ok(funnelService.analyzeAdHoc(websiteId, request));
    }
}
