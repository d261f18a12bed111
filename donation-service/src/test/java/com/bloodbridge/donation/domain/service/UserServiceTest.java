package com.bloodbridge.donation.domain.service;

import com.bloodbridge.common.exception.ResourceNotFoundException;
import com.bloodbridge.common.exception.ValidationFailureException;
import com.bloodbridge.donation.api.dto.RegisterUserRequest;
import com.bloodbridge.donation.api.dto.UserResponse;
import com.bloodbridge.donation.config.DonationRulesProperties;
import com.bloodbridge.donation.domain.model.BloodGroup;
import com.bloodbridge.donation.domain.model.User;
import com.bloodbridge.donation.domain.model.UserType;
import com.bloodbridge.donation.domain.policy.EligibilityEvaluator;
import com.bloodbridge.donation.domain.repository.DonationRecordRepository;
import com.bloodbridge.donation.domain.repository.UserRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class UserServiceTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2026, 4, 2, 15, 0);

    @Mock
    private UserRepository userRepository;
    @Mock
    private DonationRecordRepository donationRecordRepository;

    private UserService service;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW.toInstant(ZoneOffset.UTC), ZoneOffset.UTC);
        EligibilityEvaluator evaluator = new EligibilityEvaluator(DonationRulesProperties.defaults(), clock);
        service = new UserService(userRepository, donationRecordRepository, evaluator,
                new StatisticsAggregator(evaluator), clock);
    }

    @Test
    @DisplayName("register: donor gets defaults and a normalised email")
    void register_donor() {
        given(userRepository.existsByEmailIgnoreCase("ravi@example.com")).willReturn(false);
        given(userRepository.save(any(User.class))).willAnswer(inv -> inv.getArgument(0));

        UserResponse response = service.register(new RegisterUserRequest("Ravi", " Ravi@Example.com ",
                UserType.DONOR, BloodGroup.O_POS, "+91 99999 00000", "Pune", "411001", 30, 72.5));

        assertThat(response.email()).isEqualTo("ravi@example.com");
        assertThat(response.donationCount()).isZero();
        assertThat(response.available()).isTrue();
        assertThat(response.verified()).isFalse();
        assertThat(response.canDonate()).isTrue();
        assertThat(response.createdAt()).isEqualTo(NOW);
    }

    @Test
    void register_donorWithoutBloodGroup_isRejected() {
        given(userRepository.existsByEmailIgnoreCase("ravi@example.com")).willReturn(false);

        assertThatThrownBy(() -> service.register(new RegisterUserRequest("Ravi", "ravi@example.com",
                UserType.DONOR, null, "+91 99999 00000", "Pune", "411001", 30, 72.5)))
                .isInstanceOf(ValidationFailureException.class)
                .hasMessageContaining("Blood group");
        verify(userRepository, never()).save(any());
    }

    @Test
    void register_patientWithBloodGroup_isRejected() {
        given(userRepository.existsByEmailIgnoreCase("meera@example.com")).willReturn(false);

        assertThatThrownBy(() -> service.register(new RegisterUserRequest("Meera", "meera@example.com",
                UserType.PATIENT, BloodGroup.A_NEG, "+91 99999 00001", "Pune", "411002", null, null)))
                .isInstanceOf(ValidationFailureException.class);
    }

    @Test
    void register_duplicateEmail_isRejected() {
        given(userRepository.existsByEmailIgnoreCase("ravi@example.com")).willReturn(true);

        assertThatThrownBy(() -> service.register(new RegisterUserRequest("Ravi", "ravi@example.com",
                UserType.HOSPITAL, null, "+91 99999 00000", "Pune", "411001", null, null)))
                .isInstanceOf(ValidationFailureException.class)
                .hasMessageContaining("already exists");
    }

    @Test
    void updateAvailability_patient_isRejected() {
        User patient = User.builder().id(3L).userType(UserType.PATIENT).build();
        given(userRepository.findById(3L)).willReturn(Optional.of(patient));

        assertThatThrownBy(() -> service.updateAvailability(3L, false))
                .isInstanceOf(ValidationFailureException.class);
    }

    @Test
    void updateAvailability_donor_turnsOffCanDonate() {
        User donor = User.builder().id(4L).userType(UserType.DONOR).bloodGroup(BloodGroup.B_POS).build();
        given(userRepository.findById(4L)).willReturn(Optional.of(donor));
        given(userRepository.saveAndFlush(donor)).willReturn(donor);

        UserResponse response = service.updateAvailability(4L, false);

        assertThat(response.available()).isFalse();
        assertThat(response.canDonate()).isFalse();
    }

    @Test
    @DisplayName("deleteAccount removes donation records before the user")
    void deleteAccount_cascadesToDonations() {
        User donor = User.builder().id(4L).userType(UserType.DONOR).bloodGroup(BloodGroup.B_POS).build();
        given(userRepository.findById(4L)).willReturn(Optional.of(donor));

        service.deleteAccount(4L);

        InOrder order = inOrder(donationRecordRepository, userRepository);
        order.verify(donationRecordRepository).deleteByDonorId(4L);
        order.verify(userRepository).deleteById(4L);
    }

    @Test
    void deleteAccount_unknownUser_throwsNotFound() {
        given(userRepository.findById(4L)).willReturn(Optional.empty());

        assertThatThrownBy(() -> service.deleteAccount(4L))
                .isInstanceOf(ResourceNotFoundException.class);
        verify(donationRecordRepository, never()).deleteByDonorId(any());
    }
}
