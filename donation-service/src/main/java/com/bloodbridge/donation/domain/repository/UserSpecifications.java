package com.bloodbridge.donation.domain.repository;

import com.bloodbridge.donation.domain.model.BloodGroup;
import com.bloodbridge.donation.domain.model.User;
import com.bloodbridge.donation.domain.model.UserType;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;

import java.util.Collection;

/**
 * Query building blocks for user and donor lookups. Null arguments mean "no filter".
 */
public final class UserSpecifications {

    /** Most experienced donors first, then earliest registrations. */
    public static final Sort DONOR_ORDER = Sort.by(Sort.Order.desc("donationCount"), Sort.Order.asc("createdAt"));

    private UserSpecifications() {
        // Utility class
    }

    public static Specification<User> hasUserType(UserType userType) {
        return (root, query, cb) -> userType == null ? null : cb.equal(root.get("userType"), userType);
    }

    public static Specification<User> hasBloodGroup(BloodGroup bloodGroup) {
        return (root, query, cb) -> bloodGroup == null ? null : cb.equal(root.get("bloodGroup"), bloodGroup);
    }

    public static Specification<User> bloodGroupIn(Collection<BloodGroup> groups) {
        return (root, query, cb) -> root.get("bloodGroup").in(groups);
    }

    public static Specification<User> isAvailable(Boolean available) {
        return (root, query, cb) -> available == null ? null : cb.equal(root.get("available"), available);
    }

    public static Specification<User> cityContains(String city) {
        return (root, query, cb) -> BloodRequestSpecifications.isBlank(city) ? null
                : cb.like(cb.lower(root.get("city")), "%" + city.trim().toLowerCase() + "%");
    }

    public static Specification<User> hasPincode(String pincode) {
        return (root, query, cb) -> BloodRequestSpecifications.isBlank(pincode) ? null
                : cb.equal(root.get("pincode"), pincode.trim());
    }
}
