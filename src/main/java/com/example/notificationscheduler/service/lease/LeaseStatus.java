package com.example.notificationscheduler.service.lease;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum LeaseStatus {
    ACQUIRED(null),
    UNGUARDED(null),
    HELD("LEASE_HELD"),
    OWNER_MISMATCH("OWNER_MISMATCH"),
    ERROR("LEASE_ERROR");

    /**
     * Reason code reported when a run is skipped
     */
    private final String reasonCode;

    public boolean allowsRun() {
        return this == ACQUIRED || this == UNGUARDED;
    }
}
