package com.bloodbridge.donation.api.dto;

import java.time.LocalDateTime;

/**
 * Per-donor rollup. {@code daysSinceLastDonation} and {@code lastDonation} are null when
 * the donor has no counted donations.
 */
public record UserSummaryResponse(
        long totalDonations,
        long completedDonations,
        long totalUnits,
        long totalPoints,
        double averagePointsPerDonation,
        LocalDateTime lastDonation,
        LocalDateTime firstDonation,
        Long daysSinceLastDonation,
        boolean canDonate
) {
}
