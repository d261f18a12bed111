package com.bloodbridge.donation.api.dto;

import com.bloodbridge.donation.domain.model.BloodGroup;
import com.bloodbridge.donation.domain.model.BloodRequest;
import com.bloodbridge.donation.domain.model.UrgencyLevel;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;

/**
 * @param hoursRemaining whole hours left before expiry, rounded up; null unless the request is active
 */
public record BloodRequestResponse(
        Long id,
        String patientName,
        BloodGroup bloodGroup,
        UrgencyLevel urgency,
        String hospital,
        String city,
        String pincode,
        Integer unitsNeeded,
        String contactPhone,
        String description,
        Long requesterId,
        String requesterName,
        BloodRequest.RequestStatus status,
        List<Long> fulfilledBy,
        LocalDateTime expiresAt,
        Long hoursRemaining,
        LocalDateTime createdAt
) {
    public static BloodRequestResponse from(BloodRequest request, LocalDateTime now) {
        BloodRequest.RequestStatus status = request.effectiveStatus(now);
        Long hoursRemaining = null;
        if (status == BloodRequest.RequestStatus.ACTIVE) {
            long millis = Duration.between(now, request.getExpiresAt()).toMillis();
            hoursRemaining = millis <= 0 ? 0L : (millis + 3_599_999L) / 3_600_000L;
        }
        return new BloodRequestResponse(
                request.getId(),
                request.getPatientName(),
                request.getBloodGroup(),
                request.getUrgency(),
                request.getHospital(),
                request.getCity(),
                request.getPincode(),
                request.getUnitsNeeded(),
                request.getContactPhone(),
                request.getDescription(),
                request.getRequesterId(),
                request.getRequesterName(),
                status,
                List.copyOf(request.getFulfilledBy()),
                request.getExpiresAt(),
                hoursRemaining,
                request.getCreatedAt()
        );
    }
}
