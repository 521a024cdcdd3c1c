package com.advisor.chase.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Dashboard aggregation over chase items and activities")
public class AnalyticsSnapshot {

    @Schema(description = "Total chase items tracked", example = "120")
    private int totalChaseItems;

    @Schema(description = "Items waiting on a first send or a response", example = "64")
    private int pendingItems;

    @Schema(description = "Items currently overdue or escalated", example = "9")
    private int overdueItems;

    @Schema(description = "Items received or completed since midnight UTC", example = "4")
    private int completedToday;

    @Schema(description = "Average days from first contact to resolution", example = "12.4")
    private double avgCompletionDays;

    @Schema(description = "Estimated advisor hours saved (15 minutes per automated attempt)", example = "31.5")
    private double timeSavedHours;

    @Schema(description = "Percentage of activities that succeeded", example = "96.2")
    private double automationRate;

    @Schema(description = "Number of chase agents plus the orchestrator", example = "3")
    private int activeAgents;

    @Schema(description = "Activity events dropped because an observer fell behind", example = "0")
    private long droppedEvents;

    @Schema(description = "Item counts per status")
    private Map<String, Integer> statusDistribution;

    @Schema(description = "Item counts per chase type")
    private Map<String, Integer> typeDistribution;

    @Schema(description = "Item counts per priority")
    private Map<String, Integer> priorityDistribution;

    @Schema(description = "Activity counts for the last seven days, oldest first")
    private List<DailyCount> dailyActivityTrend;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class DailyCount {
        private String date;
        private long count;
    }
}
