package com.bloodbridge.donation.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * Registered donor, patient or hospital.
 * {@code donationCount} and {@code lastDonation} are written only when a donation is completed.
 */
@Entity
@Table(name = "users", indexes = {
        @Index(name = "idx_users_user_type", columnList = "user_type"),
        @Index(name = "idx_users_blood_group", columnList = "blood_group"),
        @Index(name = "idx_users_city_pincode", columnList = "city,pincode"),
        @Index(name = "idx_users_available", columnList = "is_available")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class User {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "name", nullable = false, length = 50)
    private String name;

    @Column(name = "email", nullable = false, unique = true)
    private String email;

    @Enumerated(EnumType.STRING)
    @Column(name = "user_type", nullable = false, length = 20)
    private UserType userType;

    @Column(name = "blood_group", length = 3)
    private BloodGroup bloodGroup;

    @Column(name = "phone", nullable = false, length = 20)
    private String phone;

    @Column(name = "city", nullable = false, length = 50)
    private String city;

    @Column(name = "pincode", nullable = false, length = 6)
    private String pincode;

    @Column(name = "age")
    private Integer age;

    @Column(name = "weight")
    private Double weight;

    @Builder.Default
    @Column(name = "donation_count", nullable = false)
    private Integer donationCount = 0;

    @Builder.Default
    @Column(name = "is_available", nullable = false)
    private Boolean available = true;

    @Column(name = "last_donation")
    private LocalDateTime lastDonation;

    @Builder.Default
    @Column(name = "is_verified", nullable = false)
    private Boolean verified = false;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    public boolean isDonor() {
        return userType == UserType.DONOR;
    }
}
