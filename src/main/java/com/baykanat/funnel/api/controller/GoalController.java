package com.baykanat.funnel.api.controller;

import com.baykanat.funnel.api.dto.BulkGoalAnalyticsRequest;
import com.baykanat.funnel.api.dto.FunnelReport;
import com.baykanat.funnel.api.dto.GoalRequest;
import com.baykanat.funnel.api.dto.GoalResponse;
import com.baykanat.funnel.api.dto.GoalUpdateRequest;
import com.baykanat.funnel.domain.service.GoalService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
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
import java.util.Map;

/** /websites/{websiteId}/goals: hedef CRUD, tekil ve toplu analiz. */
@RestController
@RequestMapping("/websites/{websiteId}/goals")
@RequiredArgsConstructor
@Validated
@Tag(name = "Goals", description = "Single-step goals measured against total site traffic")
public class GoalController {

    private final GoalService goalService;

    @GetMapping
    @Operation(summary = "List goals")
    public ResponseEntity<List<GoalResponse>> listGoals(@PathVariable("websiteId") String websiteId) {
        return ResponseEntity.ok(goalService.list(websiteId));
    }

    @GetMapping("/{goalId}")
    @Operation(summary = "Get a goal")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Goal found"),
            @ApiResponse(responseCode = "404", description = "Goal not found or deleted")
    })
    public ResponseEntity<GoalResponse> getGoal(@PathVariable("websiteId") String websiteId,
                                                @PathVariable("goalId") String goalId) {
        return ResponseEntity.ok(goalService.get(websiteId, goalId));
    }

    @PostMapping
    @Operation(summary = "Create a goal")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Goal created"),
            @ApiResponse(responseCode = "400", description = "Invalid goal definition")
    })
    public ResponseEntity<GoalResponse> createGoal(@PathVariable("websiteId") String websiteId,
                                                   @Valid @RequestBody GoalRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(goalService.create(websiteId, request));
    }

    @PutMapping("/{goalId}")
    @Operation(summary = "Update a goal", description = "Partial update; omitted fields are unchanged")
    public ResponseEntity<GoalResponse> updateGoal(@PathVariable("websiteId") String websiteId,
                                                   @PathVariable("goalId") String goalId,
                                                   @Valid @RequestBody GoalUpdateRequest request) {
        return ResponseEntity.ok(goalService.update(websiteId, goalId, request));
    }

    @DeleteMapping("/{goalId}")
    @Operation(summary = "Delete a goal", description = "Soft delete")
    public ResponseEntity<Void> deleteGoal(@PathVariable("websiteId") String websiteId,
                                           @PathVariable("goalId") String goalId) {
        goalService.delete(websiteId, goalId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{goalId}/analytics")
    @Operation(summary = "Goal analytics", description = "Goal completions as a share of distinct site visitors")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Report computed"),
            @ApiResponse(responseCode = "404", description = "Goal not found"),
            @ApiResponse(responseCode = "503", description = "Event store unavailable")
    })
    public ResponseEntity<FunnelReport> getGoalAnalytics(
            @PathVariable("websiteId") String websiteId,
            @PathVariable("goalId") String goalId,
            @Parameter(description = "Inclusive start date (yyyy-MM-dd)", example = "2026-01-01")
            @RequestParam(value = "start_date", required = false) String startDate,
            @Parameter(description = "Inclusive end date (yyyy-MM-dd)", example = "2026-01-31")
            @RequestParam(value = "end_date", required = false) String endDate) {
        return ResponseEntity.ok(goalService.getAnalytics(websiteId, goalId, startDate, endDate));
    }

    /** Yanıt goal_id → rapor; sıra istekteki sırayla aynı. */
    @PostMapping("/analytics/bulk")
    @Operation(summary = "Bulk goal analytics", description = "Computes several goals concurrently over one date range")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Reports computed"),
            @ApiResponse(responseCode = "400", description = "Invalid request"),
            @ApiResponse(responseCode = "404", description = "One of the goals was not found"),
            @ApiResponse(responseCode = "503", description = "Event store unavailable or timed out")
    })
    public ResponseEntity<Map<String, FunnelReport>> bulkGoalAnalytics(@PathVariable("websiteId") String websiteId,
                                                                       @Valid @RequestBody BulkGoalAnalyticsRequest request) {
        return ResponseEntity.ok(goalService.bulkAnalytics(websiteId, request));
    }
}
