package com.bloodbridge.donation.domain.service;

import com.bloodbridge.common.exception.ValidationFailureException;
import com.bloodbridge.donation.api.dto.UserResponse;
import com.bloodbridge.donation.domain.model.BloodGroup;
import com.bloodbridge.donation.domain.model.User;
import com.bloodbridge.donation.domain.model.UserType;
import com.bloodbridge.donation.domain.policy.BloodCompatibility;
import com.bloodbridge.donation.domain.policy.EligibilityEvaluator;
import com.bloodbridge.donation.domain.repository.UserRepository;
import com.bloodbridge.donation.domain.repository.UserSpecifications;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Set;

import static com.bloodbridge.donation.domain.repository.UserSpecifications.bloodGroupIn;
import static com.bloodbridge.donation.domain.repository.UserSpecifications.cityContains;
import static com.bloodbridge.donation.domain.repository.UserSpecifications.hasPincode;
import static com.bloodbridge.donation.domain.repository.UserSpecifications.hasUserType;
import static com.bloodbridge.donation.domain.repository.UserSpecifications.isAvailable;

/**
 * Finds available donors whose blood group can serve a requested group.
 * Donors still in their cooldown are listed too; each result carries its {@code canDonate} flag.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DonorMatchingService {

    private final UserRepository userRepository;
    private final EligibilityEvaluator eligibilityEvaluator;

    @Transactional(readOnly = true)
    public List<UserResponse> findCompatibleDonors(BloodGroup bloodGroup, String city, String pincode) {
        if (bloodGroup == null) {
            throw new ValidationFailureException("Blood group is required");
        }
        Set<BloodGroup> groups = BloodCompatibility.compatibleDonors(bloodGroup);
        log.debug("Searching donors for {} among groups {}, city: {}, pincode: {}", bloodGroup, groups, city, pincode);

        Specification<User> spec = Specification.where(hasUserType(UserType.DONOR))
                .and(bloodGroupIn(groups))
                .and(isAvailable(true))
                .and(cityContains(city))
                .and(hasPincode(pincode));

        return userRepository.findAll(spec, UserSpecifications.DONOR_ORDER).stream()
                .map(donor -> UserResponse.from(donor, eligibilityEvaluator.canDonate(donor)))
                .toList();
    }
}
