package com.bloodbridge.donation.api.dto;

import com.bloodbridge.donation.domain.model.BloodGroup;

import java.time.LocalDateTime;

public record LeaderboardEntry(
        Long donorId,
        String name,
        BloodGroup bloodGroup,
        long totalDonations,
        long totalUnits,
        long totalPoints,
        LocalDateTime lastDonation
) {
}
