package com.bloodbridge.donation.api.dto;

import jakarta.validation.constraints.NotNull;

public record UpdateAvailabilityRequest(
        @NotNull(message = "Availability flag is required")
        Boolean available
) {
}
