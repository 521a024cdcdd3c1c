package com.advisor.chase.engine;

import com.advisor.chase.model.ChaseStatus;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import static com.advisor.chase.model.ChaseStatus.*;

/**
 * The allowed edge set of the chase item lifecycle.
 *
 * <pre>
 * CREATED -> PENDING -> SENT -> AWAITING_RESPONSE -> OVERDUE -> ESCALATED -> AWAITING_RESPONSE
 *                        ^                             |
 *                        +------- follow-up -----------+
 * </pre>
 *
 * RECEIVED is reachable from any state in which a communication is outstanding.
 * COMPLETED and FAILED are reachable from every non-terminal state. Terminal states have no exits.
 */
public final class ChaseStateMachine {

    private static final Map<ChaseStatus, Set<ChaseStatus>> EDGES = new EnumMap<>(ChaseStatus.class);

    static {
        EDGES.put(CREATED, EnumSet.of(PENDING));
        EDGES.put(PENDING, EnumSet.of(SENT));
        EDGES.put(SENT, EnumSet.of(AWAITING_RESPONSE, RECEIVED));
        EDGES.put(AWAITING_RESPONSE, EnumSet.of(OVERDUE, RECEIVED));
        EDGES.put(OVERDUE, EnumSet.of(SENT, ESCALATED, RECEIVED));
        EDGES.put(ESCALATED, EnumSet.of(AWAITING_RESPONSE, RECEIVED));
        for (ChaseStatus status : ChaseStatus.values()) {
            if (status.isTerminal()) {
                EDGES.put(status, EnumSet.noneOf(ChaseStatus.class));
            } else {
                EDGES.get(status).add(COMPLETED);
                EDGES.get(status).add(FAILED);
            }
        }
    }

    private ChaseStateMachine() {}

    public static boolean isAllowed(ChaseStatus from, ChaseStatus to) {
        if (from == null || to == null) return false;
        return EDGES.get(from).contains(to);
    }

    public static Set<ChaseStatus> allowedTargets(ChaseStatus from) {
        return Collections.unmodifiableSet(EDGES.get(from));
    }
}
