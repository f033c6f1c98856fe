package com.example.notificationscheduler.domain.repository;

import com.example.notificationscheduler.domain.entity.JobLease;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

/**
 * Repository for job leases.
 * <p>
 * Acquisition goes through {@link JobLeaseRepositoryCustom#tryAcquire}; release and
 * extension are scoped by owner so a run can never touch a lease it no longer holds.
 */
@Repository
public interface JobLeaseRepository extends JpaRepository<JobLease, String>, JobLeaseRepositoryCustom {

    /**
     * Release a lease held by the given owner.
     *
     * @return number of rows deleted (0 if the lease expired and was taken over)
     */
    @Transactional
    @Modifying
    @Query("DELETE FROM JobLease l WHERE l.jobName = :jobName AND l.ownerId = :ownerId")
    int deleteByJobNameAndOwnerId(@Param("jobName") String jobName, @Param("ownerId") String ownerId);

    /**
     * Push the expiry of a lease still held by the given owner.
     *
     * @return number of rows updated (0 if the owner no longer holds the lease)
     */
    @Transactional
    @Modifying
    @Query("""
            UPDATE JobLease l
            SET l.lockedUntil = :lockedUntil
            WHERE l.jobName = :jobName
              AND l.ownerId = :ownerId
            """)
    int extendLease(
            @Param("jobName") String jobName,
            @Param("ownerId") String ownerId,
            @Param("lockedUntil") Instant lockedUntil
    );
}
