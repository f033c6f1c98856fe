package com.example.notificationscheduler.domain.repository;

import java.time.Instant;
import java.util.Optional;

public interface JobLeaseRepositoryCustom {

    /**
     * Insert the lease row, or take it over if the existing row has expired, in one statement.
     *
     * @return the owner id now stored on the row, or empty if an unexpired lease blocked the write
     */
    Optional<String> tryAcquire(String jobName, String ownerId, Instant now, Instant lockedUntil);
}
