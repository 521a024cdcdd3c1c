package com.advisor.chase.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Summary of one orchestrator tick")
public class TickSummary {

    @Schema(description = "Tick start (epoch millis)")
    private long startedAt;

    @Schema(description = "Items found due", example = "12")
    private int dueCount;

    @Schema(description = "Items leased and handed to workers", example = "11")
    private int leasedCount;

    @Schema(description = "Items whose plan was committed", example = "10")
    private int processedCount;

    @Schema(description = "Plans discarded by the version check", example = "1")
    private int conflictCount;

    @Schema(description = "Items skipped because another worker held the lease", example = "1")
    private int skippedCount;

    @Schema(description = "True when the tick did not run or stopped because scheduling is halted")
    private boolean halted;
}
