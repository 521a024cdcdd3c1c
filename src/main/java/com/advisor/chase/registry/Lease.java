package com.advisor.chase.registry;

import com.advisor.chase.model.ChaseItem;

/**
 * Exclusive right to process one item. {@code version} is the item version observed at
 * acquisition; a commit under this lease succeeds only if the item still has it.
 */
public record Lease(String itemId, long seq, long version, ChaseItem snapshot, long acquiredAt) {}
