package com.advisor.chase.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "twilio")
public class TwilioChannelConfig {

    private String accountSid;
    private String authToken;
    private String fromNumber;
    // When disabled every channel runs in simulation mode (logged, reported as delivered).
    private boolean enabled = false;
    private String voice = "Polly.Amy";
}
