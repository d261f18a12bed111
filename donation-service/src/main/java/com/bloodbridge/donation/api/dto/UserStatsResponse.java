package com.bloodbridge.donation.api.dto;

import com.bloodbridge.donation.domain.model.BloodGroup;

import java.util.List;

public record UserStatsResponse(
        long totalUsers,
        long totalDonors,
        long totalPatients,
        long totalHospitals,
        long availableDonors,
        long verifiedUsers,
        List<BloodGroupShare> bloodGroupDistribution
) {
    public record BloodGroupShare(BloodGroup bloodGroup, long count) {
    }
}
