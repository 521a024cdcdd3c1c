package com.advisor.chase.controller;

import com.advisor.chase.model.AnalyticsSnapshot;
import com.advisor.chase.service.AnalyticsService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/analytics")
@Tag(name = "Analytics", description = "Dashboard aggregates over chase items and activity")
public class AnalyticsController {

    private final AnalyticsService analyticsService;

    public AnalyticsController(AnalyticsService analyticsService) {
        this.analyticsService = analyticsService;
    }

    @Operation(summary = "Get analytics snapshot",
            description = "Counts by status, type and priority, pending and overdue totals, completions today, " +
                    "average completion time, estimated advisor time saved, automation rate and a 7-day " +
                    "activity trend.")
    @GetMapping("/snapshot")
    public ResponseEntity<AnalyticsSnapshot> getSnapshot() {
        return ResponseEntity.ok(analyticsService.getSnapshot());
    }
}
