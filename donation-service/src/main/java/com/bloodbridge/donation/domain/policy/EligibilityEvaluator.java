package com.bloodbridge.donation.domain.policy;

import com.bloodbridge.donation.config.DonationRulesProperties;
import com.bloodbridge.donation.domain.model.User;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Decides whether a user may donate now.
 * <p>
 * The cooldown arithmetic is exposed as {@link #daysSince(LocalDateTime)} and
 * {@link #isCooledDown(LocalDateTime)} so the statistics summary applies the exact same rule.
 */
@Component
@RequiredArgsConstructor
public class EligibilityEvaluator {

    private final DonationRulesProperties rules;
    private final Clock clock;

    public boolean canDonate(User user) {
        if (user == null || !user.isDonor() || !Boolean.TRUE.equals(user.getAvailable())) {
            return false;
        }
        return isCooledDown(user.getLastDonation());
    }

    /**
     * Human-readable reason for {@link #canDonate(User)} being false, or null when eligible.
     */
    public String ineligibilityReason(User user) {
        if (!user.isDonor()) {
            return "Only donors can record donations";
        }
        if (!Boolean.TRUE.equals(user.getAvailable())) {
            return "Donor is marked as unavailable";
        }
        if (!isCooledDown(user.getLastDonation())) {
            long remaining = rules.cooldownDays() - daysSince(user.getLastDonation());
            return String.format("Donor must wait %d more day(s) before donating again", remaining);
        }
        return null;
    }

    /**
     * True when there is no previous donation, or at least {@code cooldownDays} whole days have passed.
     */
    public boolean isCooledDown(LocalDateTime lastDonation) {
        return lastDonation == null || daysSince(lastDonation) >= rules.cooldownDays();
    }

    /**
     * Whole days elapsed since {@code lastDonation}, rounded down; null when there is none.
     */
    public Long daysSince(LocalDateTime lastDonation) {
        if (lastDonation == null) {
            return null;
        }
        return daysBetween(lastDonation, LocalDateTime.now(clock));
    }

    public int cooldownDays() {
        return rules.cooldownDays();
    }

    static long daysBetween(LocalDateTime from, LocalDateTime to) {
        return Math.floorDiv(Duration.between(from, to).toMillis(), Duration.ofDays(1).toMillis());
    }
}
