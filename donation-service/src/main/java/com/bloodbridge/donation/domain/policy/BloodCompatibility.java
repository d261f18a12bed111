package com.bloodbridge.donation.domain.policy;

import com.bloodbridge.donation.domain.model.BloodGroup;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Which donor groups are offered for a requested group.
 * <p>
 * This is the simplified lookup used for matching: the requested group itself, the universal
 * donor O-, and O+ when the requested group is Rh-positive. It does not model full ABO/Rh
 * cross-matching (an A+ request is not matched with A- donors, for instance).
 */
public final class BloodCompatibility {

    private BloodCompatibility() {
        // Utility class
    }

    public static Set<BloodGroup> compatibleDonors(BloodGroup requested) {
        EnumSet<BloodGroup> groups = EnumSet.of(requested, BloodGroup.O_NEG);
        if (requested.isRhPositive()) {
            groups.add(BloodGroup.O_POS);
        }
        return Collections.unmodifiableSet(groups);
    }
}
