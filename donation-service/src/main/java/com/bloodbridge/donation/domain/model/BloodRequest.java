package com.bloodbridge.donation.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A patient's or hospital's request for blood.
 * {@code expiresAt} and {@code priority} are fixed at creation; status only moves out of ACTIVE.
 */
@Entity
@Table(name = "blood_requests", indexes = {
        @Index(name = "idx_requests_status_priority", columnList = "status,priority"),
        @Index(name = "idx_requests_group_city", columnList = "blood_group,city"),
        @Index(name = "idx_requests_expires_at", columnList = "expires_at"),
        @Index(name = "idx_requests_requester", columnList = "requester_id")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BloodRequest {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "patient_name", nullable = false, length = 100)
    private String patientName;

    @Column(name = "blood_group", nullable = false, length = 3)
    private BloodGroup bloodGroup;

    @Enumerated(EnumType.STRING)
    @Column(name = "urgency", nullable = false, length = 20)
    private UrgencyLevel urgency;

    @Column(name = "priority", nullable = false)
    private Integer priority;

    @Column(name = "hospital", nullable = false, length = 200)
    private String hospital;

    @Column(name = "city", nullable = false, length = 50)
    private String city;

    @Column(name = "pincode", nullable = false, length = 6)
    private String pincode;

    @Column(name = "units_needed", nullable = false)
    private Integer unitsNeeded;

    @Column(name = "contact_phone", nullable = false, length = 20)
    private String contactPhone;

    @Column(name = "description", length = 500)
    private String description;

    @Column(name = "requester_id", nullable = false)
    private Long requesterId;

    @Column(name = "requester_name", nullable = false, length = 50)
    private String requesterName;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private RequestStatus status;

    @Builder.Default
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "blood_request_donors", joinColumns = @JoinColumn(name = "request_id"))
    @Column(name = "donor_id", nullable = false)
    private Set<Long> fulfilledBy = new LinkedHashSet<>();

    @Column(name = "expires_at", nullable = false)
    private LocalDateTime expiresAt;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @Version
    @Column(name = "version")
    private Long version;

    /**
     * True once {@code now} is strictly after {@code expiresAt}.
     */
    public boolean isExpiredAt(LocalDateTime now) {
        return now.isAfter(expiresAt);
    }

    /**
     * Status as observed at {@code now}: an ACTIVE request past its expiry reads as EXPIRED.
     */
    public RequestStatus effectiveStatus(LocalDateTime now) {
        return status == RequestStatus.ACTIVE && isExpiredAt(now) ? RequestStatus.EXPIRED : status;
    }

    public enum RequestStatus {
        ACTIVE,
        FULFILLED,
        EXPIRED,
        CANCELLED;

        public boolean isTerminal() {
            return this != ACTIVE;
        }
    }
}
