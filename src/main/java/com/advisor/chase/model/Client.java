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
@Schema(description = "Advised client and the contact channels documents are chased through")
public class Client {

    @Schema(description = "Client identifier", example = "CLIENT-001")
    private String clientId;

    @Schema(description = "Full name", example = "Sarah Thompson")
    private String name;

    @Schema(description = "Email address", example = "sarah.thompson@example.com")
    private String email;

    @Schema(description = "Mobile number in E.164 form", example = "+447700900456")
    private String phone;

    @Schema(description = "Risk profile tag", example = "balanced")
    private String riskProfile;

    public boolean hasAnyContact() {
        return (email != null && !email.isBlank()) || (phone != null && !phone.isBlank());
    }
}
