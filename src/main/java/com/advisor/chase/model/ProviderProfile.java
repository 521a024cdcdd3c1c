package com.advisor.chase.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Provider response behaviour learned from completed chases using EWMA statistics")
public class ProviderProfile {

    @Schema(description = "Provider identifier", example = "Aviva")
    private String providerId;

    @Schema(description = "Number of realized latencies folded into the statistics", example = "42")
    @Builder.Default
    private long sampleCount = 0;

    @Schema(description = "EWMA of response latency (millis)", example = "1296000000")
    @Builder.Default
    private double ewmaLatencyMillis = 0.0;

    @Schema(description = "Most recent realized latencies (millis), oldest first, used for the percentile")
    @Builder.Default
    private List<Long> recentLatencies = new ArrayList<>();

    @Schema(description = "Chases answered by this provider", example = "40")
    @Builder.Default
    private long receivedCount = 0;

    @Schema(description = "Chases against this provider that ended in failure", example = "2")
    @Builder.Default
    private long failedCount = 0;

    @Schema(description = "Resolved or failed chases against this provider that went overdue first", example = "11")
    @Builder.Default
    private long overdueCount = 0;

    @Schema(description = "Last profile update timestamp (epoch millis)", example = "1739886764000")
    @Builder.Default
    private long lastUpdated = 0;

    /**
     * 90th percentile of the recent latency window, or 0 when no samples exist.
     */
    public double getP90LatencyMillis() {
        if (recentLatencies == null || recentLatencies.isEmpty()) return 0.0;
        List<Long> sorted = new ArrayList<>(recentLatencies);
        sorted.sort(Long::compareTo);
        int index = (int) Math.ceil(0.9 * sorted.size()) - 1;
        return sorted.get(Math.max(0, index));
    }

    public double getFailureRate() {
        long terminal = receivedCount + failedCount;
        if (terminal == 0) return 0.0;
        return failedCount / (double) terminal;
    }

    /**
     * Share of terminal chases that went overdue before resolving or failing.
     */
    public double getOverdueRate() {
        long terminal = receivedCount + failedCount;
        if (terminal == 0) return 0.0;
        return Math.min(1.0, overdueCount / (double) terminal);
    }

    @JsonIgnore
    public boolean hasLatencyHistory() {
        return sampleCount > 0 && ewmaLatencyMillis > 0;
    }
}
