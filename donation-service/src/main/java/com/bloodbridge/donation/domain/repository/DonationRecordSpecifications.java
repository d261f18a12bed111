package com.bloodbridge.donation.domain.repository;

import com.bloodbridge.donation.domain.model.BloodGroup;
import com.bloodbridge.donation.domain.model.DonationRecord;
import com.bloodbridge.donation.domain.model.DonationRecord.DonationStatus;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;

public final class DonationRecordSpecifications {

    public static final Sort NEWEST_FIRST = Sort.by(Sort.Order.desc("date"));

    private DonationRecordSpecifications() {
        // Utility class
    }

    public static Specification<DonationRecord> hasStatus(DonationStatus status) {
        return (root, query, cb) -> status == null ? null : cb.equal(root.get("status"), status);
    }

    public static Specification<DonationRecord> hasBloodGroup(BloodGroup bloodGroup) {
        return (root, query, cb) -> bloodGroup == null ? null : cb.equal(root.get("bloodGroup"), bloodGroup);
    }

    public static Specification<DonationRecord> cityContains(String city) {
        return (root, query, cb) -> BloodRequestSpecifications.isBlank(city) ? null
                : cb.like(cb.lower(root.get("city")), "%" + city.trim().toLowerCase() + "%");
    }
}
