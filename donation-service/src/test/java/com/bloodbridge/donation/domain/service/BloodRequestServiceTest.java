package com.bloodbridge.donation.domain.service;

import com.bloodbridge.common.exception.ForbiddenOperationException;
import com.bloodbridge.common.exception.InvalidStateException;
import com.bloodbridge.common.exception.ResourceNotFoundException;
import com.bloodbridge.common.exception.ValidationFailureException;
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
import com.bloodbridge.donation.domain.repository.UserRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link BloodRequestService}: expiry deadlines, lazy expiry,
 * guarded transitions and requester checks.
 */
@ExtendWith(MockitoExtension.class)
class BloodRequestServiceTest {

    private static final LocalDateTime T0 = LocalDateTime.of(2026, 3, 1, 8, 0);
    private static final Long REQUESTER_ID = 7L;
    private static final Long DONOR_ID = 21L;
    private static final Long REQUEST_ID = 100L;

    @Mock
    private BloodRequestRepository bloodRequestRepository;
    @Mock
    private UserRepository userRepository;

    private BloodRequestService service;

    @BeforeEach
    void setUp() {
        service = serviceAt(T0);
    }

    @ParameterizedTest
    @EnumSource(UrgencyLevel.class)
    @DisplayName("createRequest: expiresAt - createdAt equals the urgency's TTL exactly")
    void createRequest_expiryMatchesTtl(UrgencyLevel urgency) {
        when(userRepository.findById(REQUESTER_ID)).thenReturn(Optional.of(requester()));
        when(bloodRequestRepository.save(any(BloodRequest.class))).thenAnswer(inv -> inv.getArgument(0));

        BloodRequestResponse response = service.createRequest(REQUESTER_ID, createPayload(urgency));

        ArgumentCaptor<BloodRequest> captor = ArgumentCaptor.forClass(BloodRequest.class);
        verify(bloodRequestRepository).save(captor.capture());
        BloodRequest saved = captor.getValue();

        Duration expected = switch (urgency) {
            case CRITICAL -> Duration.ofHours(24);
            case URGENT -> Duration.ofHours(72);
            case NORMAL -> Duration.ofDays(7);
        };
        assertThat(Duration.between(saved.getCreatedAt(), saved.getExpiresAt())).isEqualTo(expected);
        assertThat(saved.getCreatedAt()).isEqualTo(T0);
        assertThat(saved.getPriority()).isEqualTo(urgency.getPriority());
        assertThat(saved.getStatus()).isEqualTo(RequestStatus.ACTIVE);
        assertThat(saved.getRequesterName()).isEqualTo("City Hospital");
        assertThat(response.hoursRemaining()).isEqualTo(expected.toHours());
    }

    @Test
    void createRequest_unknownRequester_throwsNotFound() {
        when(userRepository.findById(REQUESTER_ID)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.createRequest(REQUESTER_ID, createPayload(UrgencyLevel.NORMAL)))
                .isInstanceOf(ResourceNotFoundException.class);
        verify(bloodRequestRepository, never()).save(any());
    }

    @Test
    @DisplayName("getRequest at T0+25h reports a critical request as EXPIRED without any explicit expiry call")
    void getRequest_afterDeadline_reportsExpired() {
        BloodRequest critical = activeRequest(UrgencyLevel.CRITICAL);
        LocalDateTime later = T0.plusHours(25);
        service = serviceAt(later);
        when(bloodRequestRepository.findById(REQUEST_ID)).thenReturn(Optional.of(critical));

        BloodRequestResponse response = service.getRequest(REQUEST_ID);

        verify(bloodRequestRepository).expireIfDue(REQUEST_ID, later);
        assertThat(response.status()).isEqualTo(RequestStatus.EXPIRED);
        assertThat(response.hoursRemaining()).isNull();
    }

    @Test
    void getRequest_beforeDeadline_reportsRemainingHoursRoundedUp() {
        service = serviceAt(T0.plusMinutes(90));
        when(bloodRequestRepository.findById(REQUEST_ID)).thenReturn(Optional.of(activeRequest(UrgencyLevel.CRITICAL)));

        BloodRequestResponse response = service.getRequest(REQUEST_ID);

        assertThat(response.status()).isEqualTo(RequestStatus.ACTIVE);
        assertThat(response.hoursRemaining()).isEqualTo(23L);
    }

    @ParameterizedTest
    @EnumSource(value = RequestStatus.class, names = {"FULFILLED", "EXPIRED", "CANCELLED"})
    @DisplayName("fulfillRequest on a terminal request fails with InvalidState and writes nothing")
    void fulfillRequest_terminal_throwsInvalidState(RequestStatus terminal) {
        BloodRequest request = activeRequest(UrgencyLevel.URGENT);
        request.setStatus(terminal);
        when(userRepository.findById(DONOR_ID)).thenReturn(Optional.of(donor()));
        when(bloodRequestRepository.findById(REQUEST_ID)).thenReturn(Optional.of(request));

        assertThatThrownBy(() -> service.fulfillRequest(REQUEST_ID, DONOR_ID))
                .isInstanceOf(InvalidStateException.class)
                .hasMessageContaining(terminal.name());

        verify(bloodRequestRepository).transitionLiveRequest(REQUEST_ID, RequestStatus.FULFILLED, T0);
        verify(bloodRequestRepository, never()).saveAndFlush(any());
    }

    @Test
    @DisplayName("fulfillRequest: guarded update wins, donor is added to fulfilledBy without saving the request")
    void fulfillRequest_active_registersDonor() {
        BloodRequest request = activeRequest(UrgencyLevel.NORMAL);
        when(userRepository.findById(DONOR_ID)).thenReturn(Optional.of(donor()));
        when(bloodRequestRepository.findById(REQUEST_ID)).thenReturn(Optional.of(request));
        when(bloodRequestRepository.transitionLiveRequest(REQUEST_ID, RequestStatus.FULFILLED, T0)).thenAnswer(inv -> {
            request.setStatus(RequestStatus.FULFILLED);
            return 1;
        });
        when(bloodRequestRepository.addDonor(REQUEST_ID, DONOR_ID))
                .thenAnswer(inv -> request.getFulfilledBy().add(DONOR_ID) ? 1 : 0);

        BloodRequestResponse response = service.fulfillRequest(REQUEST_ID, DONOR_ID);

        assertThat(response.status()).isEqualTo(RequestStatus.FULFILLED);
        assertThat(response.fulfilledBy()).containsExactly(DONOR_ID);
        verify(bloodRequestRepository, never()).saveAndFlush(any());
        verify(bloodRequestRepository, never()).save(any());
    }

    @Test
    @DisplayName("fulfillRequest: a donor already in fulfilledBy is not added twice")
    void fulfillRequest_donorAlreadyRegistered_isNoOp() {
        BloodRequest request = activeRequest(UrgencyLevel.NORMAL);
        request.getFulfilledBy().add(DONOR_ID);
        when(userRepository.findById(DONOR_ID)).thenReturn(Optional.of(donor()));
        when(bloodRequestRepository.findById(REQUEST_ID)).thenReturn(Optional.of(request));
        when(bloodRequestRepository.transitionLiveRequest(REQUEST_ID, RequestStatus.FULFILLED, T0)).thenReturn(1);
        when(bloodRequestRepository.addDonor(REQUEST_ID, DONOR_ID)).thenReturn(0);

        BloodRequestResponse response = service.fulfillRequest(REQUEST_ID, DONOR_ID);

        assertThat(response.fulfilledBy()).containsExactly(DONOR_ID);
    }

    @Test
    void fulfillRequest_byPatient_isForbidden() {
        User patient = User.builder().id(DONOR_ID).userType(UserType.PATIENT).build();
        when(userRepository.findById(DONOR_ID)).thenReturn(Optional.of(patient));

        assertThatThrownBy(() -> service.fulfillRequest(REQUEST_ID, DONOR_ID))
                .isInstanceOf(ForbiddenOperationException.class);
        verify(bloodRequestRepository, never()).transitionLiveRequest(any(), any(), any());
    }

    @Test
    void cancelRequest_byOtherUser_isForbidden() {
        when(bloodRequestRepository.findById(REQUEST_ID)).thenReturn(Optional.of(activeRequest(UrgencyLevel.URGENT)));

        assertThatThrownBy(() -> service.cancelRequest(REQUEST_ID, 999L))
                .isInstanceOf(ForbiddenOperationException.class);
        verify(bloodRequestRepository, never()).transitionLiveRequest(any(), any(), any());
    }

    @Test
    void cancelRequest_byRequester_transitionsToCancelled() {
        when(bloodRequestRepository.findById(REQUEST_ID)).thenReturn(Optional.of(activeRequest(UrgencyLevel.URGENT)));
        when(bloodRequestRepository.transitionLiveRequest(REQUEST_ID, RequestStatus.CANCELLED, T0)).thenReturn(1);

        service.cancelRequest(REQUEST_ID, REQUESTER_ID);

        verify(bloodRequestRepository).transitionLiveRequest(REQUEST_ID, RequestStatus.CANCELLED, T0);
    }

    @Test
    void cancelRequest_lostRace_throwsInvalidState() {
        BloodRequest request = activeRequest(UrgencyLevel.URGENT);
        when(bloodRequestRepository.findById(REQUEST_ID)).thenReturn(Optional.of(request));
        when(bloodRequestRepository.transitionLiveRequest(REQUEST_ID, RequestStatus.CANCELLED, T0)).thenAnswer(inv -> {
            request.setStatus(RequestStatus.FULFILLED);
            return 0;
        });

        assertThatThrownBy(() -> service.cancelRequest(REQUEST_ID, REQUESTER_ID))
                .isInstanceOf(InvalidStateException.class)
                .hasMessageContaining("FULFILLED");
    }

    @Test
    @DisplayName("updateRequest on an expired request fails with InvalidState")
    void updateRequest_expired_throwsInvalidState() {
        service = serviceAt(T0.plusDays(8));
        when(bloodRequestRepository.findById(REQUEST_ID)).thenReturn(Optional.of(activeRequest(UrgencyLevel.NORMAL)));
        UpdateBloodRequestRequest update = new UpdateBloodRequestRequest(
                null, null, null, null, 3, null, null);

        assertThatThrownBy(() -> service.updateRequest(REQUEST_ID, REQUESTER_ID, update))
                .isInstanceOf(InvalidStateException.class)
                .hasMessageContaining("EXPIRED");
        verify(bloodRequestRepository, never()).saveAndFlush(any());
    }

    @Test
    void updateRequest_changesOnlyProvidedFields() {
        BloodRequest request = activeRequest(UrgencyLevel.URGENT);
        LocalDateTime expiresAt = request.getExpiresAt();
        when(bloodRequestRepository.findById(REQUEST_ID)).thenReturn(Optional.of(request));
        when(bloodRequestRepository.saveAndFlush(request)).thenReturn(request);
        UpdateBloodRequestRequest update = new UpdateBloodRequestRequest(
                null, "General Hospital", null, null, 4, null, "Surgery moved up");

        BloodRequestResponse response = service.updateRequest(REQUEST_ID, REQUESTER_ID, update);

        assertThat(response.hospital()).isEqualTo("General Hospital");
        assertThat(response.unitsNeeded()).isEqualTo(4);
        assertThat(response.description()).isEqualTo("Surgery moved up");
        assertThat(response.patientName()).isEqualTo("Asha Rao");
        assertThat(response.expiresAt()).isEqualTo(expiresAt);
    }

    @ParameterizedTest
    @ValueSource(ints = {0, 11})
    void createRequest_unitsOutOfRange_isRejected(int units) {
        CreateBloodRequestRequest payload = new CreateBloodRequestRequest("Asha Rao", BloodGroup.B_POS,
                UrgencyLevel.URGENT, "City Hospital", "Pune", "411001", units, "+91 98765 43210", null);

        assertThatThrownBy(() -> service.createRequest(REQUESTER_ID, payload))
                .isInstanceOf(ValidationFailureException.class)
                .hasMessage("Units needed must be between 1 and 10, got " + units);
        verify(bloodRequestRepository, never()).save(any());
    }

    @Test
    void updateRequest_unitsOutOfRange_isRejected() {
        when(bloodRequestRepository.findById(REQUEST_ID)).thenReturn(Optional.of(activeRequest(UrgencyLevel.URGENT)));
        UpdateBloodRequestRequest update = new UpdateBloodRequestRequest(
                null, null, null, null, 11, null, null);

        assertThatThrownBy(() -> service.updateRequest(REQUEST_ID, REQUESTER_ID, update))
                .isInstanceOf(ValidationFailureException.class);
        verify(bloodRequestRepository, never()).saveAndFlush(any());
    }

    @Test
    void search_blankText_isRejected() {
        assertThatThrownBy(() -> service.search("  ", null, null))
                .isInstanceOf(ValidationFailureException.class);
        verify(bloodRequestRepository, never()).expireAllDue(any());
    }

    @Test
    void getRequestStats_foldsStatusAndUrgencyCounts() {
        when(bloodRequestRepository.countByStatusAndUrgency()).thenReturn(List.of(
                new Row(RequestStatus.ACTIVE, UrgencyLevel.CRITICAL, 2L),
                new Row(RequestStatus.ACTIVE, UrgencyLevel.NORMAL, 1L),
                new Row(RequestStatus.FULFILLED, UrgencyLevel.URGENT, 3L),
                new Row(RequestStatus.EXPIRED, UrgencyLevel.CRITICAL, 1L),
                new Row(RequestStatus.CANCELLED, UrgencyLevel.NORMAL, 4L)
        ));

        RequestStatsResponse stats = service.getRequestStats();

        verify(bloodRequestRepository).expireAllDue(T0);
        assertThat(stats).isEqualTo(new RequestStatsResponse(11, 3, 3, 1, 4, 3, 3, 5));
    }

    private BloodRequestService serviceAt(LocalDateTime now) {
        Clock clock = Clock.fixed(now.toInstant(ZoneOffset.UTC), ZoneOffset.UTC);
        return new BloodRequestService(bloodRequestRepository, userRepository, DonationRulesProperties.defaults(), clock);
    }

    private static CreateBloodRequestRequest createPayload(UrgencyLevel urgency) {
        return new CreateBloodRequestRequest("Asha Rao", BloodGroup.B_POS, urgency, "City Hospital",
                "Pune", "411001", 2, "+91 98765 43210", null);
    }

    private static BloodRequest activeRequest(UrgencyLevel urgency) {
        Duration ttl = DonationRulesProperties.defaults().ttlFor(urgency);
        return BloodRequest.builder()
                .id(REQUEST_ID)
                .patientName("Asha Rao")
                .bloodGroup(BloodGroup.B_POS)
                .urgency(urgency)
                .priority(urgency.getPriority())
                .hospital("City Hospital")
                .city("Pune")
                .pincode("411001")
                .unitsNeeded(2)
                .contactPhone("+91 98765 43210")
                .requesterId(REQUESTER_ID)
                .requesterName("City Hospital")
                .status(RequestStatus.ACTIVE)
                .createdAt(T0)
                .expiresAt(T0.plus(ttl))
                .build();
    }

    private static User requester() {
        return User.builder().id(REQUESTER_ID).name("City Hospital").userType(UserType.HOSPITAL).build();
    }

    private static User donor() {
        return User.builder().id(DONOR_ID).name("Ravi").userType(UserType.DONOR).bloodGroup(BloodGroup.O_POS).build();
    }

    private record Row(RequestStatus getStatus, UrgencyLevel getUrgency, Long getTotal)
            implements BloodRequestRepository.StatusUrgencyCount {
    }
}
