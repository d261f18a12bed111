package com.bloodbridge.donation.domain.repository;

import com.bloodbridge.donation.domain.model.BloodRequest;
import com.bloodbridge.donation.domain.model.BloodRequest.RequestStatus;
import com.bloodbridge.donation.domain.model.UrgencyLevel;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Repository for {@link BloodRequest}.
 * Status changes go through guarded single-statement UPDATEs so that the check and the
 * write cannot be separated by a concurrent caller.
 */
public interface BloodRequestRepository extends JpaRepository<BloodRequest, Long>,
        JpaSpecificationExecutor<BloodRequest> {

    Page<BloodRequest> findByRequesterId(Long requesterId, Pageable pageable);

    /**
     * Moves an ACTIVE, not-yet-expired request to {@code target}.
     *
     * Returns the number of rows affected:
     * - 1: transition applied
     * - 0: the request was no longer ACTIVE, had expired, or does not exist
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
           UPDATE BloodRequest r
           SET r.status = :target, r.updatedAt = :now, r.version = r.version + 1
           WHERE r.id = :id
             AND r.status = :active
             AND r.expiresAt >= :now
           """)
    int transitionLiveRequest(@Param("id") Long id,
                              @Param("active") RequestStatus active,
                              @Param("target") RequestStatus target,
                              @Param("now") LocalDateTime now);

    /**
     * Flips one ACTIVE request to EXPIRED if its deadline has passed.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
           UPDATE BloodRequest r
           SET r.status = :expired, r.updatedAt = :now, r.version = r.version + 1
           WHERE r.id = :id
             AND r.status = :active
             AND r.expiresAt < :now
           """)
    int expireIfDue(@Param("id") Long id,
                    @Param("active") RequestStatus active,
                    @Param("expired") RequestStatus expired,
                    @Param("now") LocalDateTime now);

    /**
     * Flips every ACTIVE request whose deadline has passed. Run before listings and statistics.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
           UPDATE BloodRequest r
           SET r.status = :expired, r.updatedAt = :now, r.version = r.version + 1
           WHERE r.status = :active
             AND r.expiresAt < :now
           """)
    int expireAllDue(@Param("active") RequestStatus active,
                     @Param("expired") RequestStatus expired,
                     @Param("now") LocalDateTime now);

    /**
     * Adds a donor to a request's fulfilling set in one statement, without touching the
     * request row or its version. Concurrent donors for the same request do not conflict.
     *
     * Returns 1 if the donor was added, 0 if already present.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query(value = """
           INSERT INTO blood_request_donors (request_id, donor_id)
           SELECT CAST(:requestId AS BIGINT), CAST(:donorId AS BIGINT)
           WHERE NOT EXISTS (
               SELECT 1 FROM blood_request_donors d
               WHERE d.request_id = :requestId AND d.donor_id = :donorId)
           """, nativeQuery = true)
    int addDonor(@Param("requestId") Long requestId, @Param("donorId") Long donorId);

    default int transitionLiveRequest(Long id, RequestStatus target, LocalDateTime now) {
        return transitionLiveRequest(id, RequestStatus.ACTIVE, target, now);
    }

    default int expireIfDue(Long id, LocalDateTime now) {
        return expireIfDue(id, RequestStatus.ACTIVE, RequestStatus.EXPIRED, now);
    }

    default int expireAllDue(LocalDateTime now) {
        return expireAllDue(RequestStatus.ACTIVE, RequestStatus.EXPIRED, now);
    }

    @Query("""
           SELECT r.status AS status, r.urgency AS urgency, COUNT(r) AS total
           FROM BloodRequest r
           GROUP BY r.status, r.urgency
           """)
    List<StatusUrgencyCount> countByStatusAndUrgency();

    interface StatusUrgencyCount {
        RequestStatus getStatus();

        UrgencyLevel getUrgency();

        Long getTotal();
    }
}
