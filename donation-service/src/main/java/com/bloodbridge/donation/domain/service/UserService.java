package com.bloodbridge.donation.domain.service;

import com.bloodbridge.common.dto.PageResponse;
import com.bloodbridge.common.exception.ResourceNotFoundException;
import com.bloodbridge.common.exception.ValidationFailureException;
import com.bloodbridge.common.util.Paging;
import com.bloodbridge.donation.api.dto.RegisterUserRequest;
import com.bloodbridge.donation.api.dto.UserResponse;
import com.bloodbridge.donation.api.dto.UserStatsResponse;
import com.bloodbridge.donation.config.CacheConfig;
import com.bloodbridge.donation.domain.model.BloodGroup;
import com.bloodbridge.donation.domain.model.User;
import com.bloodbridge.donation.domain.model.UserType;
import com.bloodbridge.donation.domain.policy.EligibilityEvaluator;
import com.bloodbridge.donation.domain.repository.DonationRecordRepository;
import com.bloodbridge.donation.domain.repository.UserRepository;
import com.bloodbridge.donation.domain.repository.UserSpecifications;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Locale;

import static com.bloodbridge.donation.domain.repository.UserSpecifications.cityContains;
import static com.bloodbridge.donation.domain.repository.UserSpecifications.hasBloodGroup;
import static com.bloodbridge.donation.domain.repository.UserSpecifications.hasPincode;
import static com.bloodbridge.donation.domain.repository.UserSpecifications.hasUserType;
import static com.bloodbridge.donation.domain.repository.UserSpecifications.isAvailable;

@Slf4j
@Service
@RequiredArgsConstructor
public class UserService {

    private final UserRepository userRepository;
    private final DonationRecordRepository donationRecordRepository;
    private final EligibilityEvaluator eligibilityEvaluator;
    private final StatisticsAggregator aggregator;
    private final Clock clock;

    /**
     * Registers a user. Donors must state blood group, age and weight; other user types
     * carry no blood group.
     */
    @Transactional
    public UserResponse register(RegisterUserRequest request) {
        String email = request.email().trim().toLowerCase(Locale.ROOT);
        log.info("Registering {} user with email {}", request.userType(), email);

        if (userRepository.existsByEmailIgnoreCase(email)) {
            throw new ValidationFailureException("A user with email " + email + " already exists");
        }
        if (request.userType() == UserType.DONOR) {
            if (request.bloodGroup() == null) {
                throw new ValidationFailureException("Blood group is required for donors");
            }
            if (request.age() == null) {
                throw new ValidationFailureException("Age is required for donors");
            }
            if (request.weight() == null) {
                throw new ValidationFailureException("Weight is required for donors");
            }
        } else if (request.bloodGroup() != null) {
            throw new ValidationFailureException("Blood group applies to donors only");
        }

        LocalDateTime now = LocalDateTime.now(clock);
        User user = User.builder()
                .name(request.name().trim())
                .email(email)
                .userType(request.userType())
                .bloodGroup(request.bloodGroup())
                .phone(request.phone().trim())
                .city(request.city().trim())
                .pincode(request.pincode())
                .age(request.age())
                .weight(request.weight())
                .createdAt(now)
                .updatedAt(now)
                .build();

        user = userRepository.save(user);
        log.info("User {} registered", user.getId());
        return toResponse(user);
    }

    @Transactional(readOnly = true)
    public UserResponse getUser(Long id) {
        return toResponse(load(id));
    }

    @Transactional(readOnly = true)
    public PageResponse<UserResponse> listUsers(UserType userType, BloodGroup bloodGroup, String city,
                                                String pincode, Boolean available,
                                                Integer page, Integer limit) {
        Specification<User> spec = Specification.where(hasUserType(userType))
                .and(hasBloodGroup(bloodGroup))
                .and(cityContains(city))
                .and(hasPincode(pincode))
                .and(isAvailable(available));
        return PageResponse.from(
                userRepository.findAll(spec, Paging.of(page, limit, UserSpecifications.DONOR_ORDER)),
                this::toResponse);
    }

    @Transactional
    public UserResponse updateAvailability(Long userId, boolean available) {
        User user = load(userId);
        if (!user.isDonor()) {
            throw new ValidationFailureException("Only donors have an availability setting");
        }
        user.setAvailable(available);
        user.setUpdatedAt(LocalDateTime.now(clock));
        user = userRepository.saveAndFlush(user);
        log.info("Donor {} availability set to {}", userId, available);
        return toResponse(user);
    }

    /**
     * Deletes the account together with its donation records. Blood requests the user created
     * remain, carrying the requester name captured when they were created.
     */
    @Transactional
    @CacheEvict(cacheNames = {CacheConfig.LEADERBOARD, CacheConfig.DONATION_STATS,
            CacheConfig.DONATIONS_BY_BLOOD_GROUP}, allEntries = true)
    public void deleteAccount(Long userId) {
        User user = load(userId);
        int removed = donationRecordRepository.deleteByDonorId(userId);
        userRepository.deleteById(user.getId());
        log.info("User {} deleted with {} donation record(s)", userId, removed);
    }

    @Transactional(readOnly = true)
    public UserStatsResponse getUserStats() {
        return aggregator.userStats(
                userRepository.countByUserType(),
                userRepository.countByBloodGroup(UserType.DONOR));
    }

    private User load(Long id) {
        return userRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("User", id));
    }

    private UserResponse toResponse(User user) {
        return UserResponse.from(user, eligibilityEvaluator.canDonate(user));
    }
}
