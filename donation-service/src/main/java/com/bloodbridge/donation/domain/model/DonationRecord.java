package com.bloodbridge.donation.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * One donation by one donor, optionally answering a blood request.
 * Donor name and blood group are snapshots taken when the record is created.
 * Once COMPLETED or CANCELLED the record is never modified again.
 */
@Entity
@Table(name = "donation_records", indexes = {
        @Index(name = "idx_donations_donor_date", columnList = "donor_id,donation_date"),
        @Index(name = "idx_donations_request", columnList = "request_id"),
        @Index(name = "idx_donations_status", columnList = "status"),
        @Index(name = "idx_donations_blood_group", columnList = "blood_group")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DonationRecord {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "donor_id", nullable = false)
    private Long donorId;

    @Column(name = "donor_name", nullable = false, length = 50)
    private String donorName;

    @Column(name = "blood_group", nullable = false, length = 3)
    private BloodGroup bloodGroup;

    @Column(name = "request_id")
    private Long requestId;

    @Column(name = "donation_date", nullable = false)
    private LocalDateTime date;

    @Column(name = "hospital", nullable = false, length = 200)
    private String hospital;

    @Column(name = "city", nullable = false, length = 50)
    private String city;

    @Column(name = "units_contributed", nullable = false)
    private Integer unitsContributed;

    @Column(name = "points", nullable = false)
    private Integer points;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private DonationStatus status;

    @Column(name = "notes", length = 500)
    private String notes;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @Version
    @Column(name = "version")
    private Long version;

    public boolean isLinkedToRequest() {
        return requestId != null;
    }

    public enum DonationStatus {
        PENDING,
        COMPLETED,
        CANCELLED
    }
}
