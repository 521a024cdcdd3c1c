package com.advisor.chase.controller;

import com.advisor.chase.model.ProviderProfile;
import com.advisor.chase.service.ProviderProfileService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/providers")
@Tag(name = "Providers", description = "Provider response profiles learned from resolved chases")
public class ProviderController {

    private final ProviderProfileService profileService;

    public ProviderController(ProviderProfileService profileService) {
        this.profileService = profileService;
    }

    @Operation(summary = "Get provider response profile",
            description = "EWMA mean latency, standard deviation, p90 and failure rate. 404 until the provider " +
                    "has at least one recorded outcome.")
    @GetMapping("/{providerId}/profile")
    public ResponseEntity<ProviderProfile> getProfile(
            @Parameter(description = "Provider ID", example = "Aviva")
            @PathVariable String providerId) {
        ProviderProfile profile = profileService.getProfile(providerId);
        if (profile == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(profile);
    }
}
