package com.advisor.chase.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Who is being chased: a client (documents) or a provider (LOAs)")
public class ChaseTarget {

    @Schema(description = "Target kind", example = "PROVIDER")
    private TargetKind kind;

    @Schema(description = "Client ID or provider ID", example = "Aviva")
    private String id;

    @Schema(description = "Display name used when rendering messages", example = "Aviva")
    private String name;

    @Schema(description = "Contact email, when known at initiation", example = "loa@aviva.example")
    private String email;

    @Schema(description = "Contact phone number in E.164 form, when known at initiation", example = "+447700900123")
    private String phone;
}
