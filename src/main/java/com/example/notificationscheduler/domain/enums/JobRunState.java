package com.example.notificationscheduler.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Lifecycle of a single job invocation.
 * <p>
 * NOT_RUN → LEASE_ATTEMPTED → (SKIPPED | RUNNING → COMPLETED | FAILED).
 * Jobs without a lease go straight from NOT_RUN to RUNNING.
 */
@Getter
@RequiredArgsConstructor
public enum JobRunState {

    NOT_RUN("not-run"),

    LEASE_ATTEMPTED("lease-attempted"),

    /**
     * Lease not acquired. An expected outcome, reported with ok=true.
     */
    SKIPPED("skipped"),

    RUNNING("running"),

    COMPLETED("completed"),

    FAILED("failed");

    private final String code;

    /**
     * Check if this state ends the invocation
     */
    public boolean isTerminal() {
        return this == SKIPPED || this == COMPLETED || this == FAILED;
    }

    /**
     * Check if the transition to the given state is allowed
     */
    public boolean canTransitionTo(JobRunState next) {
        return switch (this) {
            case NOT_RUN -> next == LEASE_ATTEMPTED || next == RUNNING;
            case LEASE_ATTEMPTED -> next == SKIPPED || next == RUNNING;
            case RUNNING -> next == COMPLETED || next == FAILED;
            case SKIPPED, COMPLETED, FAILED -> false;
        };
    }
}
