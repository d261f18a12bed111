package com.bloodbridge.donation.api.dto;

import com.bloodbridge.donation.domain.model.BloodGroup;
import com.bloodbridge.donation.domain.model.DonationRecord;

import java.time.LocalDateTime;

public record DonationResponse(
        Long id,
        Long donorId,
        String donorName,
        BloodGroup bloodGroup,
        Long requestId,
        LocalDateTime date,
        String hospital,
        String city,
        Integer unitsContributed,
        Integer points,
        DonationRecord.DonationStatus status,
        String notes,
        LocalDateTime createdAt
) {
    public static DonationResponse from(DonationRecord record) {
        return new DonationResponse(
                record.getId(),
                record.getDonorId(),
                record.getDonorName(),
                record.getBloodGroup(),
                record.getRequestId(),
                record.getDate(),
                record.getHospital(),
                record.getCity(),
                record.getUnitsContributed(),
                record.getPoints(),
                record.getStatus(),
                record.getNotes(),
                record.getCreatedAt()
        );
    }
}
