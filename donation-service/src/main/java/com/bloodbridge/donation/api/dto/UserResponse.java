package com.bloodbridge.donation.api.dto;

import com.bloodbridge.donation.domain.model.BloodGroup;
import com.bloodbridge.donation.domain.model.User;
import com.bloodbridge.donation.domain.model.UserType;

import java.time.LocalDateTime;

public record UserResponse(
        Long id,
        String name,
        String email,
        UserType userType,
        BloodGroup bloodGroup,
        String phone,
        String city,
        String pincode,
        Integer age,
        Double weight,
        Integer donationCount,
        Boolean available,
        LocalDateTime lastDonation,
        Boolean verified,
        boolean canDonate,
        LocalDateTime createdAt
) {
    public static UserResponse from(User user, boolean canDonate) {
        return new UserResponse(
                user.getId(),
                user.getName(),
                user.getEmail(),
                user.getUserType(),
                user.getBloodGroup(),
                user.getPhone(),
                user.getCity(),
                user.getPincode(),
                user.getAge(),
                user.getWeight(),
                user.getDonationCount(),
                user.getAvailable(),
                user.getLastDonation(),
                user.getVerified(),
                canDonate,
                user.getCreatedAt()
        );
    }
}
