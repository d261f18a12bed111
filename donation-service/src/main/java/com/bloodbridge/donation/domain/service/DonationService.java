package com.bloodbridge.donation.domain.service;

import com.bloodbridge.common.dto.PageResponse;
import com.bloodbridge.common.exception.ForbiddenOperationException;
import com.bloodbridge.common.exception.IneligibleDonorException;
import com.bloodbridge.common.exception.InvalidStateException;
import com.bloodbridge.common.exception.ResourceNotFoundException;
import com.bloodbridge.common.exception.ValidationFailureException;
import com.bloodbridge.common.util.Paging;
import com.bloodbridge.donation.api.dto.CreateDonationRequest;
import com.bloodbridge.donation.api.dto.DonationResponse;
import com.bloodbridge.donation.api.dto.UpdateDonationRequest;
import com.bloodbridge.donation.config.CacheConfig;
import com.bloodbridge.donation.domain.model.BloodGroup;
import com.bloodbridge.donation.domain.model.DonationRecord;
import com.bloodbridge.donation.domain.model.DonationRecord.DonationStatus;
import com.bloodbridge.donation.domain.model.User;
import com.bloodbridge.donation.domain.model.UserType;
import com.bloodbridge.donation.domain.policy.EligibilityEvaluator;
import com.bloodbridge.donation.domain.policy.PointsCalculator;
import com.bloodbridge.donation.domain.repository.BloodRequestRepository;
import com.bloodbridge.donation.domain.repository.DonationRecordRepository;
import com.bloodbridge.donation.domain.repository.DonationRecordSpecifications;
import com.bloodbridge.donation.domain.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;

import static com.bloodbridge.donation.domain.repository.DonationRecordSpecifications.cityContains;
import static com.bloodbridge.donation.domain.repository.DonationRecordSpecifications.hasBloodGroup;
import static com.bloodbridge.donation.domain.repository.DonationRecordSpecifications.hasStatus;

/**
 * Records donations and drives them from PENDING to COMPLETED or CANCELLED.
 * <p>
 * Completing a donation is the only path that touches a donor's {@code donationCount} and
 * {@code lastDonation}. The status flip and the counter increment run in one transaction, and
 * the flip is guarded on PENDING, so a record is counted at most once.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DonationService {

    private final DonationRecordRepository donationRecordRepository;
    private final UserRepository userRepository;
    private final BloodRequestRepository bloodRequestRepository;
    private final EligibilityEvaluator eligibilityEvaluator;
    private final PointsCalculator pointsCalculator;
    private final Clock clock;

    @Transactional
    @CacheEvict(cacheNames = {CacheConfig.LEADERBOARD, CacheConfig.DONATION_STATS,
            CacheConfig.DONATIONS_BY_BLOOD_GROUP}, allEntries = true)
    public DonationResponse createDonation(Long donorId, CreateDonationRequest request) {
        log.info("Recording donation for donor {}, units: {}, request: {}",
                donorId, request.unitsContributed(), request.requestId());

        User donor = userRepository.findById(donorId)
                .orElseThrow(() -> new ResourceNotFoundException("User", donorId));
        String reason = eligibilityEvaluator.ineligibilityReason(donor);
        if (reason != null) {
            throw new IneligibleDonorException(reason);
        }
        if (request.bloodGroup() != null && request.bloodGroup() != donor.getBloodGroup()) {
            throw new ValidationFailureException(String.format(
                    "Blood group %s does not match the donor's registered group %s",
                    request.bloodGroup(), donor.getBloodGroup()));
        }

        LocalDateTime now = LocalDateTime.now(clock);
        LocalDateTime date = request.date() != null ? request.date() : now;
        requireNotInFuture(date, now);

        boolean linked = request.requestId() != null;
        int points = pointsCalculator.points(request.unitsContributed(), linked);
        if (linked) {
            registerWithRequest(request.requestId(), donorId);
        }

        DonationRecord record = DonationRecord.builder()
                .donorId(donor.getId())
                .donorName(donor.getName())
                .bloodGroup(donor.getBloodGroup())
                .requestId(request.requestId())
                .date(date)
                .hospital(request.hospital().trim())
                .city(request.city().trim())
                .unitsContributed(request.unitsContributed())
                .points(points)
                .status(DonationStatus.PENDING)
                .notes(request.notes())
                .createdAt(now)
                .updatedAt(now)
                .build();

        record = donationRecordRepository.save(record);
        log.info("Donation {} recorded for donor {} with {} points", record.getId(), donorId, points);
        return DonationResponse.from(record);
    }

    /**
     * PENDING to COMPLETED, then bumps the donor's counter and last donation date.
     * Allowed for the owning donor and for hospital users.
     */
    @Transactional
    @CacheEvict(cacheNames = {CacheConfig.LEADERBOARD, CacheConfig.DONATION_STATS,
            CacheConfig.DONATIONS_BY_BLOOD_GROUP}, allEntries = true)
    public DonationResponse completeDonation(Long recordId, Long actorId) {
        log.info("Completing donation {} by user {}", recordId, actorId);
        DonationRecord record = load(recordId);
        if (!record.getDonorId().equals(actorId) && !isHospital(actorId)) {
            throw new ForbiddenOperationException(
                    "Only the donor or a hospital can complete donation " + recordId);
        }

        LocalDateTime now = LocalDateTime.now(clock);
        int updated = donationRecordRepository.transitionStatus(
                recordId, DonationStatus.PENDING, DonationStatus.COMPLETED, now);
        if (updated == 0) {
            throw new InvalidStateException(String.format(
                    "Donation %d is %s and cannot be completed", recordId, load(recordId).getStatus()));
        }

        int touched = userRepository.recordCompletedDonation(record.getDonorId(), record.getDate(), now);
        if (touched == 0) {
            throw new ResourceNotFoundException("User", record.getDonorId());
        }

        log.info("Donation {} completed, donor {} counters updated", recordId, record.getDonorId());
        return DonationResponse.from(load(recordId));
    }

    /**
     * Edits a pending donation. Points are recomputed when the unit count changes.
     */
    @Transactional
    @CacheEvict(cacheNames = {CacheConfig.LEADERBOARD, CacheConfig.DONATION_STATS,
            CacheConfig.DONATIONS_BY_BLOOD_GROUP}, allEntries = true)
    public DonationResponse updateDonation(Long recordId, Long actorId, UpdateDonationRequest update) {
        DonationRecord record = load(recordId);
        requireOwner(record, actorId, "update");
        requirePending(record, "updated");

        LocalDateTime now = LocalDateTime.now(clock);
        if (update.hospital() != null) {
            record.setHospital(update.hospital().trim());
        }
        if (update.city() != null) {
            record.setCity(update.city().trim());
        }
        if (update.notes() != null) {
            record.setNotes(update.notes());
        }
        if (update.date() != null) {
            requireNotInFuture(update.date(), now);
            record.setDate(update.date());
        }
        if (update.unitsContributed() != null && !update.unitsContributed().equals(record.getUnitsContributed())) {
            record.setPoints(pointsCalculator.points(update.unitsContributed(), record.isLinkedToRequest()));
            record.setUnitsContributed(update.unitsContributed());
        }
        record.setUpdatedAt(now);

        record = donationRecordRepository.saveAndFlush(record);
        log.info("Donation {} updated by donor {}", recordId, actorId);
        return DonationResponse.from(record);
    }

    @Transactional
    @CacheEvict(cacheNames = {CacheConfig.LEADERBOARD, CacheConfig.DONATION_STATS,
            CacheConfig.DONATIONS_BY_BLOOD_GROUP}, allEntries = true)
    public void cancelDonation(Long recordId, Long actorId) {
        DonationRecord record = load(recordId);
        requireOwner(record, actorId, "cancel");

        int updated = donationRecordRepository.transitionStatus(
                recordId, DonationStatus.PENDING, DonationStatus.CANCELLED, LocalDateTime.now(clock));
        if (updated == 0) {
            throw new InvalidStateException(String.format(
                    "Donation %d is %s and cannot be cancelled", recordId, load(recordId).getStatus()));
        }
        log.info("Donation {} cancelled by donor {}", recordId, actorId);
    }

    @Transactional(readOnly = true)
    public DonationResponse getDonation(Long recordId) {
        return DonationResponse.from(load(recordId));
    }

    @Transactional(readOnly = true)
    public PageResponse<DonationResponse> listDonations(DonationStatus status, BloodGroup bloodGroup, String city,
                                                        Integer page, Integer limit) {
        Specification<DonationRecord> spec = Specification.where(hasStatus(status))
                .and(hasBloodGroup(bloodGroup))
                .and(cityContains(city));
        return PageResponse.from(
                donationRecordRepository.findAll(spec, Paging.of(page, limit, DonationRecordSpecifications.NEWEST_FIRST)),
                DonationResponse::from);
    }

    @Transactional(readOnly = true)
    public PageResponse<DonationResponse> listByDonor(Long donorId, Integer page, Integer limit) {
        return PageResponse.from(
                donationRecordRepository.findByDonorId(donorId,
                        Paging.of(page, limit, DonationRecordSpecifications.NEWEST_FIRST)),
                DonationResponse::from);
    }

    /**
     * Adds the donor to the request's fulfilling set. The request's state is not checked here;
     * fulfilling the request is a separate call.
     */
    private void registerWithRequest(Long requestId, Long donorId) {
        if (!bloodRequestRepository.existsById(requestId)) {
            throw new ResourceNotFoundException("Blood request", requestId);
        }
        if (bloodRequestRepository.addDonor(requestId, donorId) > 0) {
            log.debug("Donor {} registered with blood request {}", donorId, requestId);
        }
    }

    private boolean isHospital(Long actorId) {
        return userRepository.findById(actorId)
                .map(user -> user.getUserType() == UserType.HOSPITAL)
                .orElse(false);
    }

    private DonationRecord load(Long recordId) {
        return donationRecordRepository.findById(recordId)
                .orElseThrow(() -> new ResourceNotFoundException("Donation", recordId));
    }

    private void requireOwner(DonationRecord record, Long actorId, String action) {
        if (!record.getDonorId().equals(actorId)) {
            throw new ForbiddenOperationException(String.format(
                    "Only the donor can %s donation %d", action, record.getId()));
        }
    }

    private void requirePending(DonationRecord record, String action) {
        if (record.getStatus() != DonationStatus.PENDING) {
            throw new InvalidStateException(String.format(
                    "Donation %d is %s and cannot be %s", record.getId(), record.getStatus(), action));
        }
    }

    private void requireNotInFuture(LocalDateTime date, LocalDateTime now) {
        if (date.isAfter(now)) {
            throw new ValidationFailureException("Donation date cannot be in the future");
        }
    }
}
