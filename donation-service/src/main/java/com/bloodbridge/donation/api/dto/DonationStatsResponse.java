package com.bloodbridge.donation.api.dto;

public record DonationStatsResponse(
        long totalDonations,
        long completedDonations,
        long pendingDonations,
        long cancelledDonations,
        long totalUnits,
        long totalPoints
) {
}
