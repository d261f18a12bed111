package com.bloodbridge.donation.api.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.PastOrPresent;
import jakarta.validation.constraints.Size;

import java.time.LocalDateTime;

/**
 * Partial update of a pending donation. Null fields are left unchanged.
 */
public record UpdateDonationRequest(
        @Size(min = 2, max = 200, message = "Hospital name must be between 2 and 200 characters")
        String hospital,

        @Size(min = 2, max = 50, message = "City must be between 2 and 50 characters")
        String city,

        @Min(value = 1, message = "At least 1 unit must be contributed")
        @Max(value = 2, message = "Maximum 2 units can be contributed at once")
        Integer unitsContributed,

        @PastOrPresent(message = "Donation date cannot be in the future")
        LocalDateTime date,

        @Size(max = 500, message = "Notes cannot exceed 500 characters")
        String notes
) {
}
