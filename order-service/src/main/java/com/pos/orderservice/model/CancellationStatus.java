package com.pos.orderservice.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Cancellation lifecycle of an order.
 *
 * <pre>
 * NONE --request--> REQUESTED --approve--> APPROVED
 *                             --reject---> REJECTED
 * </pre>
 *
 * APPROVED and REJECTED are terminal.
 */
public enum CancellationStatus {
    NONE,
    REQUESTED,
    APPROVED,
    REJECTED;

    private static final Map<CancellationStatus, Set<CancellationStatus>> TRANSITIONS =
            new EnumMap<>(CancellationStatus.class);

    static {
        TRANSITIONS.put(NONE, EnumSet.of(REQUESTED));
        TRANSITIONS.put(REQUESTED, EnumSet.of(APPROVED, REJECTED));
        TRANSITIONS.put(APPROVED, EnumSet.noneOf(CancellationStatus.class));
        TRANSITIONS.put(REJECTED, EnumSet.noneOf(CancellationStatus.class));
    }

    public boolean canTransitionTo(CancellationStatus next) {
        return TRANSITIONS.get(this).contains(next);
    }

    public Set<CancellationStatus> allowedTransitions() {
        return Collections.unmodifiableSet(TRANSITIONS.get(this));
    }

    public boolean isTerminal() {
        return TRANSITIONS.get(this).isEmpty();
    }
}
