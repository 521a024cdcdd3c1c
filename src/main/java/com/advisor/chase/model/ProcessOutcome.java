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
@Schema(description = "Result of evaluating one chase item")
public class ProcessOutcome {

    public enum Result {
        PROCESSED,
        SKIPPED_LEASED,
        NOOP_TERMINAL,
        CONFLICT,
        NOT_FOUND
    }

    @Schema(description = "Chase item ID")
    private String itemId;

    @Schema(description = "What happened", example = "PROCESSED")
    private Result result;

    @Schema(description = "Item state after processing, when available")
    private ChaseItem item;
}
