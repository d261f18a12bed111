package com.bloodbridge.donation.domain.policy;

import com.bloodbridge.common.exception.ValidationFailureException;
import com.bloodbridge.donation.config.DonationRulesProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Points awarded for a donation: a base amount, a bonus for answering a request,
 * and a bonus per unit beyond the first.
 */
@Component
@RequiredArgsConstructor
public class PointsCalculator {

    public static final int MIN_UNITS = 1;
    public static final int MAX_UNITS = 2;

    private final DonationRulesProperties rules;

    public int points(int unitsContributed, boolean linkedToRequest) {
        if (unitsContributed < MIN_UNITS || unitsContributed > MAX_UNITS) {
            throw new ValidationFailureException(String.format(
                    "Units contributed must be between %d and %d, got %d", MIN_UNITS, MAX_UNITS, unitsContributed));
        }
        DonationRulesProperties.Points p = rules.points();
        int total = p.base();
        if (linkedToRequest) {
            total += p.requestBonus();
        }
        total += p.extraUnit() * (unitsContributed - 1);
        return total;
    }
}
