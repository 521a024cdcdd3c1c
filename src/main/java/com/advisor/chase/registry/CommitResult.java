package com.advisor.chase.registry;

import com.advisor.chase.model.ChaseItem;

public record CommitResult(boolean applied, ChaseItem item) {

    public static CommitResult applied(ChaseItem item) {
        return new CommitResult(true, item);
    }

    public static CommitResult conflict(ChaseItem current) {
        return new CommitResult(false, current);
    }
}
