package com.advisor.chase.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Read-only query over the registry. Null fields do not filter.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChaseItemFilter {
    private ChaseStatus status;
    private ChaseType type;
    private Priority priority;
    private String clientId;
    private String providerRef;
    private boolean dueOnly;
    @Builder.Default
    private int limit = 100;

    public static ChaseItemFilter all() {
        return ChaseItemFilter.builder().build();
    }
}
