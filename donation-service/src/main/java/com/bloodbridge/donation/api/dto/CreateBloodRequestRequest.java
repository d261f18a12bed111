package com.bloodbridge.donation.api.dto;

import com.bloodbridge.donation.domain.model.BloodGroup;
import com.bloodbridge.donation.domain.model.UrgencyLevel;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

public record CreateBloodRequestRequest(
        @NotBlank(message = "Patient name is required")
        @Size(min = 2, max = 100, message = "Patient name must be between 2 and 100 characters")
        String patientName,

        @NotNull(message = "Blood group is required")
        BloodGroup bloodGroup,

        @NotNull(message = "Urgency level is required")
        UrgencyLevel urgency,

        @NotBlank(message = "Hospital name is required")
        @Size(min = 2, max = 200, message = "Hospital name must be between 2 and 200 characters")
        String hospital,

        @NotBlank(message = "City is required")
        @Size(min = 2, max = 50, message = "City must be between 2 and 50 characters")
        String city,

        @NotBlank(message = "Pincode is required")
        @Pattern(regexp = "^\\d{6}$", message = "Pincode must be exactly 6 digits")
        String pincode,

        @NotNull(message = "Units needed is required")
        @Min(value = 1, message = "At least 1 unit is required")
        @Max(value = 10, message = "Maximum 10 units can be requested at once")
        Integer unitsNeeded,

        @NotBlank(message = "Contact phone is required")
        @Pattern(regexp = "^\\+?[\\d\\s\\-()]+$", message = "Please provide a valid contact phone number")
        String contactPhone,

        @Size(max = 500, message = "Description cannot exceed 500 characters")
        String description
) {
}
