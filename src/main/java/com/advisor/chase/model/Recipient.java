package com.advisor.chase.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Resolved contact point for one communication.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Recipient {
    private String targetId;
    private String name;
    private String address;         // email address or E.164 number depending on channel
}
