package com.bloodbridge.donation.api.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/**
 * Partial update of an active request. Null fields are left unchanged.
 * Blood group and urgency are not editable: the expiry deadline is derived from urgency once.
 */
public record UpdateBloodRequestRequest(
        @Size(min = 2, max = 100, message = "Patient name must be between 2 and 100 characters")
        String patientName,

        @Size(min = 2, max = 200, message = "Hospital name must be between 2 and 200 characters")
        String hospital,

        @Size(min = 2, max = 50, message = "City must be between 2 and 50 characters")
        String city,

        @Pattern(regexp = "^\\d{6}$", message = "Pincode must be exactly 6 digits")
        String pincode,

        @Min(value = 1, message = "At least 1 unit is required")
        @Max(value = 10, message = "Maximum 10 units can be requested at once")
        Integer unitsNeeded,

        @Pattern(regexp = "^\\+?[\\d\\s\\-()]+$", message = "Please provide a valid contact phone number")
        String contactPhone,

        @Size(max = 500, message = "Description cannot exceed 500 characters")
        String description
) {
}
