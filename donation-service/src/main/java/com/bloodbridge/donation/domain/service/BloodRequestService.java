package com.bloodbridge.donation.domain.service;

import com.bloodbridge.common.dto.PageResponse;
import com.bloodbridge.common.exception.ForbiddenOperationException;
import com.bloodbridge.common.exception.InvalidStateException;
import com.bloodbridge.common.exception.ResourceNotFoundException;
import com.bloodbridge.common.exception.ValidationFailureException;
import com.bloodbridge.common.util.Constants;
import com.bloodbridge.common.util.Paging;
import com.bloodbridge.donation.api.dto.BloodRequestResponse;
import com.bloodbridge.donation.api.dto.CreateBloodRequestRequest;
import com.bloodbridge.donation.api.dto.RequestStatsResponse;
import com.bloodbridge.donation.api.dto.UpdateBloodRequestRequest;
import com.bloodbridge.donation.config.DonationRulesProperties;
import com.bloodbridge.donation.domain.model.BloodGroup;
import com.bloodbridge.donation.domain.model.BloodRequest;
import com.bloodbridge.donation.domain.model.BloodRequest.RequestStatus;
import com.bloodbridge.donation.domain.model.UrgencyLevel;
import com.bloodbridge.donation.domain.model.User;
import com.bloodbridge.donation.domain.model.UserType;
import com.bloodbridge.donation.domain.repository.BloodRequestRepository;
import com.bloodbridge.donation.domain.repository.BloodRequestSpecifications;
import com.bloodbridge.donation.domain.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

import static com.bloodbridge.donation.domain.repository.BloodRequestSpecifications.cityContains;
import static com.bloodbridge.donation.domain.repository.BloodRequestSpecifications.hasBloodGroup;
import static com.bloodbridge.donation.domain.repository.BloodRequestSpecifications.hasPincode;
import static com.bloodbridge.donation.domain.repository.BloodRequestSpecifications.hasUrgency;
import static com.bloodbridge.donation.domain.repository.BloodRequestSpecifications.liveAt;
import static com.bloodbridge.donation.domain.repository.BloodRequestSpecifications.mentions;

/**
 * Lifecycle of blood requests: active, then exactly one of fulfilled, expired or cancelled.
 * <p>
 * Expiry is reconciled lazily. Every path that reads or mutates a request first flips due
 * ACTIVE rows to EXPIRED, so callers never observe an ACTIVE request past its deadline.
 * Status transitions are single guarded UPDATEs; a zero row count means another caller
 * (or the clock) got there first.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BloodRequestService {

    public static final int MIN_UNITS_NEEDED = 1;
    public static final int MAX_UNITS_NEEDED = 10;

    private static final Sort NEWEST_FIRST = Sort.by(Sort.Order.desc("createdAt"));

    private final BloodRequestRepository bloodRequestRepository;
    private final UserRepository userRepository;
    private final DonationRulesProperties rules;
    private final Clock clock;

    @Transactional
    public BloodRequestResponse createRequest(Long requesterId, CreateBloodRequestRequest request) {
        log.info("Creating {} blood request for group {} by user {}",
                request.urgency(), request.bloodGroup(), requesterId);

        requireUnitsNeeded(request.unitsNeeded());
        User requester = userRepository.findById(requesterId)
                .orElseThrow(() -> new ResourceNotFoundException("User", requesterId));

        LocalDateTime now = LocalDateTime.now(clock);
        BloodRequest bloodRequest = BloodRequest.builder()
                .patientName(request.patientName().trim())
                .bloodGroup(request.bloodGroup())
                .urgency(request.urgency())
                .priority(request.urgency().getPriority())
                .hospital(request.hospital().trim())
                .city(request.city().trim())
                .pincode(request.pincode())
                .unitsNeeded(request.unitsNeeded())
                .contactPhone(request.contactPhone().trim())
                .description(request.description())
                .requesterId(requester.getId())
                .requesterName(requester.getName())
                .status(RequestStatus.ACTIVE)
                .expiresAt(now.plus(rules.ttlFor(request.urgency())))
                .createdAt(now)
                .updatedAt(now)
                .build();

        bloodRequest = bloodRequestRepository.save(bloodRequest);
        log.info("Blood request {} created, expires at {}", bloodRequest.getId(), bloodRequest.getExpiresAt());
        return BloodRequestResponse.from(bloodRequest, now);
    }

    @Transactional
    public BloodRequestResponse getRequest(Long id) {
        LocalDateTime now = LocalDateTime.now(clock);
        return BloodRequestResponse.from(reconcile(id, now), now);
    }

    /**
     * Active, non-expired requests, most urgent first and oldest first within a tier.
     */
    @Transactional
    public PageResponse<BloodRequestResponse> listActive(BloodGroup bloodGroup, UrgencyLevel urgency,
                                                         String city, String pincode,
                                                         Integer page, Integer limit) {
        LocalDateTime now = reconcileAll();
        Specification<BloodRequest> spec = Specification.where(liveAt(now))
                .and(hasBloodGroup(bloodGroup))
                .and(hasUrgency(urgency))
                .and(cityContains(city))
                .and(hasPincode(pincode));

        Page<BloodRequest> result = bloodRequestRepository.findAll(
                spec, Paging.of(page, limit, BloodRequestSpecifications.SERVE_ORDER));
        return PageResponse.from(result, r -> BloodRequestResponse.from(r, now));
    }

    @Transactional
    public PageResponse<BloodRequestResponse> listByRequester(Long requesterId, Integer page, Integer limit) {
        LocalDateTime now = reconcileAll();
        Page<BloodRequest> result = bloodRequestRepository.findByRequesterId(
                requesterId, Paging.of(page, limit, NEWEST_FIRST));
        return PageResponse.from(result, r -> BloodRequestResponse.from(r, now));
    }

    /**
     * Free-text search among active requests, capped at {@link Constants#MAX_SEARCH_RESULTS}.
     */
    @Transactional
    public List<BloodRequestResponse> search(String text, BloodGroup bloodGroup, String city) {
        if (text == null || text.isBlank()) {
            throw new ValidationFailureException("Search text is required");
        }
        LocalDateTime now = reconcileAll();
        Specification<BloodRequest> spec = Specification.where(liveAt(now))
                .and(mentions(text.trim()))
                .and(hasBloodGroup(bloodGroup))
                .and(cityContains(city));

        PageRequest firstPage = PageRequest.of(0, Constants.MAX_SEARCH_RESULTS, BloodRequestSpecifications.SERVE_ORDER);
        return bloodRequestRepository.findAll(spec, firstPage).stream()
                .map(r -> BloodRequestResponse.from(r, now))
                .toList();
    }

    /**
     * Edits the descriptive fields of an active request. Urgency and blood group are fixed,
     * so the expiry deadline never moves.
     */
    @Transactional
    public BloodRequestResponse updateRequest(Long id, Long actorId, UpdateBloodRequestRequest update) {
        LocalDateTime now = LocalDateTime.now(clock);
        BloodRequest bloodRequest = reconcile(id, now);
        requireRequester(bloodRequest, actorId, "update");
        requireLive(bloodRequest, now, "updated");

        if (update.patientName() != null) {
            bloodRequest.setPatientName(update.patientName().trim());
        }
        if (update.hospital() != null) {
            bloodRequest.setHospital(update.hospital().trim());
        }
        if (update.city() != null) {
            bloodRequest.setCity(update.city().trim());
        }
        if (update.pincode() != null) {
            bloodRequest.setPincode(update.pincode());
        }
        if (update.unitsNeeded() != null) {
            requireUnitsNeeded(update.unitsNeeded());
            bloodRequest.setUnitsNeeded(update.unitsNeeded());
        }
        if (update.contactPhone() != null) {
            bloodRequest.setContactPhone(update.contactPhone().trim());
        }
        if (update.description() != null) {
            bloodRequest.setDescription(update.description());
        }
        bloodRequest.setUpdatedAt(now);

        bloodRequest = bloodRequestRepository.saveAndFlush(bloodRequest);
        log.info("Blood request {} updated by user {}", id, actorId);
        return BloodRequestResponse.from(bloodRequest, now);
    }

    @Transactional
    public void cancelRequest(Long id, Long actorId) {
        LocalDateTime now = LocalDateTime.now(clock);
        BloodRequest bloodRequest = reconcile(id, now);
        requireRequester(bloodRequest, actorId, "cancel");

        int updated = bloodRequestRepository.transitionLiveRequest(id, RequestStatus.CANCELLED, now);
        if (updated == 0) {
            throw notLive(id, "cancelled");
        }
        log.info("Blood request {} cancelled by user {}", id, actorId);
    }

    /**
     * Marks an active request fulfilled and records the donor in its fulfilling set.
     * Of two concurrent callers only one sees the guarded UPDATE succeed; the other fails with
     * {@link InvalidStateException}.
     */
    @Transactional
    public BloodRequestResponse fulfillRequest(Long id, Long donorId) {
        log.info("Fulfilling blood request {} by donor {}", id, donorId);
        LocalDateTime now = LocalDateTime.now(clock);

        User donor = userRepository.findById(donorId)
                .orElseThrow(() -> new ResourceNotFoundException("User", donorId));
        if (donor.getUserType() != UserType.DONOR) {
            throw new ForbiddenOperationException("Only donors can fulfill blood requests");
        }
        reconcile(id, now);

        int updated = bloodRequestRepository.transitionLiveRequest(id, RequestStatus.FULFILLED, now);
        if (updated == 0) {
            throw notLive(id, "fulfilled");
        }

        bloodRequestRepository.addDonor(id, donorId);
        BloodRequest fulfilled = load(id);
        log.info("Blood request {} fulfilled by donor {}", id, donorId);
        return BloodRequestResponse.from(fulfilled, now);
    }

    @Transactional
    public RequestStatsResponse getRequestStats() {
        reconcileAll();
        long total = 0;
        long active = 0;
        long fulfilled = 0;
        long expired = 0;
        long cancelled = 0;
        long critical = 0;
        long urgent = 0;
        long normal = 0;

        for (BloodRequestRepository.StatusUrgencyCount row : bloodRequestRepository.countByStatusAndUrgency()) {
            long count = row.getTotal();
            total += count;
            switch (row.getStatus()) {
                case ACTIVE -> active += count;
                case FULFILLED -> fulfilled += count;
                case EXPIRED -> expired += count;
                case CANCELLED -> cancelled += count;
            }
            switch (row.getUrgency()) {
                case CRITICAL -> critical += count;
                case URGENT -> urgent += count;
                case NORMAL -> normal += count;
            }
        }
        return new RequestStatsResponse(total, active, fulfilled, expired, cancelled, critical, urgent, normal);
    }

    /**
     * Loads a request after flipping it to EXPIRED if its deadline has passed.
     */
    private BloodRequest reconcile(Long id, LocalDateTime now) {
        if (bloodRequestRepository.expireIfDue(id, now) > 0) {
            log.info("Blood request {} expired", id);
        }
        return load(id);
    }

    private LocalDateTime reconcileAll() {
        LocalDateTime now = LocalDateTime.now(clock);
        int expired = bloodRequestRepository.expireAllDue(now);
        if (expired > 0) {
            log.info("Expired {} overdue blood request(s)", expired);
        }
        return now;
    }

    private BloodRequest load(Long id) {
        return bloodRequestRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Blood request", id));
    }

    private void requireRequester(BloodRequest bloodRequest, Long actorId, String action) {
        if (!bloodRequest.getRequesterId().equals(actorId)) {
            throw new ForbiddenOperationException(String.format(
                    "Only the requester can %s blood request %d", action, bloodRequest.getId()));
        }
    }

    private void requireLive(BloodRequest bloodRequest, LocalDateTime now, String action) {
        RequestStatus status = bloodRequest.effectiveStatus(now);
        if (status != RequestStatus.ACTIVE) {
            throw new InvalidStateException(String.format(
                    "Blood request %d is %s and cannot be %s", bloodRequest.getId(), status, action));
        }
    }

    private static void requireUnitsNeeded(Integer unitsNeeded) {
        if (unitsNeeded == null || unitsNeeded < MIN_UNITS_NEEDED || unitsNeeded > MAX_UNITS_NEEDED) {
            throw new ValidationFailureException(String.format(
                    "Units needed must be between %d and %d, got %s", MIN_UNITS_NEEDED, MAX_UNITS_NEEDED, unitsNeeded));
        }
    }

    private InvalidStateException notLive(Long id, String action) {
        BloodRequest current = load(id);
        return new InvalidStateException(String.format(
                "Blood request %d is %s and cannot be %s", id, current.getStatus(), action));
    }
}
