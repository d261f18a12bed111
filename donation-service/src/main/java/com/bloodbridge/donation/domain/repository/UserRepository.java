package com.bloodbridge.donation.domain.repository;

import com.bloodbridge.donation.domain.model.BloodGroup;
import com.bloodbridge.donation.domain.model.User;
import com.bloodbridge.donation.domain.model.UserType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.List;

public interface UserRepository extends JpaRepository<User, Long>, JpaSpecificationExecutor<User> {

    boolean existsByEmailIgnoreCase(String email);

    /**
     * Increments the donor's counter and moves {@code lastDonation} in one statement.
     * The only write path for these two columns; callers run it in the same transaction
     * as the donation's PENDING -> COMPLETED transition.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
           UPDATE User u
           SET u.donationCount = u.donationCount + 1,
               u.lastDonation = :donationDate,
               u.updatedAt = :now
           WHERE u.id = :id
           """)
    int recordCompletedDonation(@Param("id") Long id,
                                @Param("donationDate") LocalDateTime donationDate,
                                @Param("now") LocalDateTime now);

    @Query("""
           SELECT u.userType AS userType,
                  COUNT(u) AS total,
                  SUM(CASE WHEN u.available = true THEN 1 ELSE 0 END) AS available,
                  SUM(CASE WHEN u.verified = true THEN 1 ELSE 0 END) AS verified
           FROM User u
           GROUP BY u.userType
           """)
    List<UserTypeTotals> countByUserType();

    @Query("""
           SELECT u.bloodGroup AS bloodGroup, COUNT(u) AS total
           FROM User u
           WHERE u.userType = :userType AND u.bloodGroup IS NOT NULL
           GROUP BY u.bloodGroup
           ORDER BY COUNT(u) DESC
           """)
    List<BloodGroupCount> countByBloodGroup(@Param("userType") UserType userType);

    interface UserTypeTotals {
        UserType getUserType();

        Long getTotal();

        Long getAvailable();

        Long getVerified();
    }

    interface BloodGroupCount {
        BloodGroup getBloodGroup();

        Long getTotal();
    }
}
