package com.advisor.chase.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Predicted delay risk for a chase item")
public class RiskAssessment {

    @Schema(description = "Chase item ID", example = "CHASE-3f1c2a")
    private String itemId;

    @Schema(description = "Risk score in [0, 1]", example = "0.71")
    private double score;

    @Schema(description = "LOW [0, 0.33), MEDIUM [0.33, 0.66), HIGH [0.66, 1]", example = "HIGH")
    private RiskLevel level;

    @Schema(description = "Expected response time used as the baseline (millis)", example = "1728000000")
    private long expectedResponseMillis;

    @Schema(description = "True when no learned provider profile was available")
    private boolean defaultProfile;

    @Schema(description = "Factors that contributed to the score")
    private List<String> riskFactors;

    @Schema(description = "Suggested next step for the advisor")
    private String recommendation;

    @Schema(description = "Assessment timestamp (epoch millis)")
    private long assessedAt;
}
