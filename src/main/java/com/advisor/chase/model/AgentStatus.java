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
@Schema(description = "Runtime status of a chase agent or the orchestrator")
public class AgentStatus {

    @Schema(description = "Agent type", example = "DOCUMENT_CHASER")
    private AgentType agentType;

    @Schema(description = "idle, busy or halted", example = "idle")
    private String status;

    @Schema(description = "Last action taken", example = "reminder_sent")
    private String lastAction;

    @Schema(description = "Last action timestamp (epoch millis), 0 if none")
    private long lastActionAt;

    @Schema(description = "Items processed since startup", example = "128")
    private long itemsProcessed;
}
