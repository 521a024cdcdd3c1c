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
@Schema(description = "Request to start chasing a document or LOA")
public class CreateChaseRequest {

    @Schema(description = "Chase type", example = "DOCUMENT")
    private ChaseType type;

    @Schema(description = "Client or provider being chased")
    private ChaseTarget target;

    @Schema(description = "Initial priority, defaults to MEDIUM", example = "HIGH")
    private Priority priority;

    @Schema(description = "Provider profile reference (required for LOA chases)", example = "Aviva")
    private String providerRef;

    @Schema(description = "Client whose advice depends on this item", example = "CLIENT-001")
    private String clientId;

    @Schema(description = "What is being chased", example = "Latest P60")
    private String description;

    @Schema(description = "Provider reference number", example = "AV-778812")
    private String referenceNumber;
}
