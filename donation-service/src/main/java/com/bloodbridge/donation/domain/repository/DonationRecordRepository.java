package com.bloodbridge.donation.domain.repository;

import com.bloodbridge.donation.domain.model.BloodGroup;
import com.bloodbridge.donation.domain.model.DonationRecord;
import com.bloodbridge.donation.domain.model.DonationRecord.DonationStatus;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.List;

public interface DonationRecordRepository extends JpaRepository<DonationRecord, Long>,
        JpaSpecificationExecutor<DonationRecord> {

    Page<DonationRecord> findByDonorId(Long donorId, Pageable pageable);

    List<DonationRecord> findByDonorIdOrderByDateDesc(Long donorId);

    List<DonationRecord> findByStatus(DonationStatus status);

    /**
     * Atomically moves a record from {@code expected} to {@code target}.
     *
     * Returns 1 when the record was still in {@code expected} at write time, 0 otherwise.
     * Two concurrent completions of the same record therefore cannot both succeed.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
           UPDATE DonationRecord d
           SET d.status = :target, d.updatedAt = :now, d.version = d.version + 1
           WHERE d.id = :id
             AND d.status = :expected
           """)
    int transitionStatus(@Param("id") Long id,
                         @Param("expected") DonationStatus expected,
                         @Param("target") DonationStatus target,
                         @Param("now") LocalDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM DonationRecord d WHERE d.donorId = :donorId")
    int deleteByDonorId(@Param("donorId") Long donorId);

    @Query("""
           SELECT d.status AS status,
                  COUNT(d) AS total,
                  SUM(d.unitsContributed) AS units,
                  SUM(d.points) AS points
           FROM DonationRecord d
           GROUP BY d.status
           """)
    List<StatusTotals> totalsByStatus();

    @Query("""
           SELECT d.bloodGroup AS bloodGroup,
                  COUNT(d) AS total,
                  SUM(d.unitsContributed) AS units,
                  SUM(d.points) AS points
           FROM DonationRecord d
           WHERE d.status = :status
           GROUP BY d.bloodGroup
           ORDER BY COUNT(d) DESC
           """)
    List<BloodGroupTotals> totalsByBloodGroup(@Param("status") DonationStatus status);

    interface StatusTotals {
        DonationStatus getStatus();

        Long getTotal();

        Long getUnits();

        Long getPoints();
    }

    interface BloodGroupTotals {
        BloodGroup getBloodGroup();

        Long getTotal();

        Long getUnits();

        Long getPoints();
    }
}
