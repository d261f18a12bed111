package com.bloodbridge.donation.api.dto;

import com.bloodbridge.donation.domain.model.BloodGroup;
import com.bloodbridge.donation.domain.model.UserType;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/**
 * Registration payload. Donor-only fields (blood group, age, weight) are checked by the service
 * against the user type.
 */
public record RegisterUserRequest(
        @NotBlank(message = "Name is required")
        @Size(min = 2, max = 50, message = "Name must be between 2 and 50 characters")
        String name,

        @NotBlank(message = "Email is required")
        @Email(message = "Please provide a valid email address")
        String email,

        @NotNull(message = "User type is required")
        UserType userType,

        BloodGroup bloodGroup,

        @NotBlank(message = "Phone number is required")
        @Pattern(regexp = "^\\+?[\\d\\s\\-()]+$", message = "Please provide a valid phone number")
        String phone,

        @NotBlank(message = "City is required")
        @Size(min = 2, max = 50, message = "City must be between 2 and 50 characters")
        String city,

        @NotBlank(message = "Pincode is required")
        @Pattern(regexp = "^\\d{6}$", message = "Pincode must be exactly 6 digits")
        String pincode,

        @Min(value = 18, message = "Age must be at least 18")
        @Max(value = 65, message = "Age must be at most 65")
        Integer age,

        @DecimalMin(value = "50", message = "Weight must be at least 50 kg")
        @DecimalMax(value = "150", message = "Weight must be at most 150 kg")
        Double weight
) {
}
