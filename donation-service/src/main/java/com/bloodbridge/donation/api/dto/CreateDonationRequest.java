package com.bloodbridge.donation.api.dto;

import com.bloodbridge.donation.domain.model.BloodGroup;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PastOrPresent;
import jakarta.validation.constraints.Size;

import java.time.LocalDateTime;

/**
 * @param bloodGroup optional; when present it must equal the donor's registered group
 * @param requestId  optional blood request this donation answers
 * @param date       optional donation date, defaults to now
 */
public record CreateDonationRequest(
        BloodGroup bloodGroup,

        @NotBlank(message = "Hospital name is required")
        @Size(min = 2, max = 200, message = "Hospital name must be between 2 and 200 characters")
        String hospital,

        @NotBlank(message = "City is required")
        @Size(min = 2, max = 50, message = "City must be between 2 and 50 characters")
        String city,

        @NotNull(message = "Units contributed is required")
        @Min(value = 1, message = "At least 1 unit must be contributed")
        @Max(value = 2, message = "Maximum 2 units can be contributed at once")
        Integer unitsContributed,

        Long requestId,

        @PastOrPresent(message = "Donation date cannot be in the future")
        LocalDateTime date,

        @Size(max = 500, message = "Notes cannot exceed 500 characters")
        String notes
) {
}
