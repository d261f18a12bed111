package com.bloodbridge.donation.api.dto;

import com.bloodbridge.donation.domain.model.BloodGroup;

public record BloodGroupDonationStats(
        BloodGroup bloodGroup,
        long count,
        long totalUnits,
        long totalPoints
) {
}
