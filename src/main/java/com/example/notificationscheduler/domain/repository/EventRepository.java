package com.example.notificationscheduler.domain.repository;

import com.example.notificationscheduler.domain.entity.Event;
import com.example.notificationscheduler.domain.enums.JoinRequestStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

/**
 * Read-only queries over events for reminder windows and digest content.
 */
@Repository
public interface EventRepository extends JpaRepository<Event, String> {

    /**
     * Events starting in the half-open window [from, to).
     */
    @Query("""
            SELECT e FROM Event e
            WHERE e.startTime >= :from
              AND e.startTime < :to
            ORDER BY e.startTime ASC
            """)
    List<Event> findStartingBetween(@Param("from") Instant from, @Param("to") Instant to);

    /**
     * Count events hosted by the user starting in [from, to].
     */
    @Query("""
            SELECT COUNT(e) FROM Event e
            WHERE e.hostId = :userId
              AND e.startTime >= :from
              AND e.startTime <= :to
            """)
    long countHostedBetween(@Param("userId") String userId, @Param("from") Instant from, @Param("to") Instant to);

    /**
     * Count events the user has an accepted join request for, starting in [from, to].
     */
    @Query("""
            SELECT COUNT(e) FROM Event e, EventJoinRequest r
            WHERE r.eventId = e.id
              AND r.userId = :userId
              AND r.status = :accepted
              AND e.startTime >= :from
              AND e.startTime <= :to
            """)
    long countAttendingBetween(@Param("userId") String userId, @Param("from") Instant from, @Param("to") Instant to,
                               @Param("accepted") JoinRequestStatus accepted);

    /**
     * Upcoming events the user hosts or attends, soonest first.
     */
    @Query("""
            SELECT e FROM Event e
            WHERE e.startTime >= :from
              AND (e.hostId = :userId
                   OR e.id IN (SELECT r.eventId FROM EventJoinRequest r
                               WHERE r.userId = :userId
                                 AND r.status = :accepted))
            ORDER BY e.startTime ASC
            """)
    List<Event> findUpcomingForUser(@Param("userId") String userId, @Param("from") Instant from,
                                    @Param("accepted") JoinRequestStatus accepted, Pageable pageable);
}
