package com.advisor.chase.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * State-change notification pushed to live observers.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ActivityEvent {
    private String type;            // always "agent_activity" for now
    private Activity activity;
    private ChaseStatus itemStatus;
    private Priority itemPriority;
    private long publishedAt;
}
