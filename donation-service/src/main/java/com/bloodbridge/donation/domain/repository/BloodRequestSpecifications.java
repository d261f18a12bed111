package com.bloodbridge.donation.domain.repository;

import com.bloodbridge.donation.domain.model.BloodGroup;
import com.bloodbridge.donation.domain.model.BloodRequest;
import com.bloodbridge.donation.domain.model.BloodRequest.RequestStatus;
import com.bloodbridge.donation.domain.model.UrgencyLevel;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;

import java.time.LocalDateTime;

/**
 * Query building blocks for blood request listings. Null arguments mean "no filter".
 */
public final class BloodRequestSpecifications {

    /** Most urgent tier first, oldest request first inside a tier. */
    public static final Sort SERVE_ORDER = Sort.by(Sort.Order.desc("priority"), Sort.Order.asc("createdAt"));

    private BloodRequestSpecifications() {
        // Utility class
    }

    public static Specification<BloodRequest> liveAt(LocalDateTime now) {
        return (root, query, cb) -> cb.and(
                cb.equal(root.get("status"), RequestStatus.ACTIVE),
                cb.greaterThanOrEqualTo(root.get("expiresAt"), now));
    }

    public static Specification<BloodRequest> hasBloodGroup(BloodGroup bloodGroup) {
        return (root, query, cb) -> bloodGroup == null ? null : cb.equal(root.get("bloodGroup"), bloodGroup);
    }

    public static Specification<BloodRequest> hasUrgency(UrgencyLevel urgency) {
        return (root, query, cb) -> urgency == null ? null : cb.equal(root.get("urgency"), urgency);
    }

    public static Specification<BloodRequest> cityContains(String city) {
        return (root, query, cb) -> isBlank(city) ? null
                : cb.like(cb.lower(root.get("city")), "%" + city.trim().toLowerCase() + "%");
    }

    public static Specification<BloodRequest> hasPincode(String pincode) {
        return (root, query, cb) -> isBlank(pincode) ? null : cb.equal(root.get("pincode"), pincode.trim());
    }

    /**
     * Case-insensitive match of {@code text} against patient name, hospital or description.
     */
    public static Specification<BloodRequest> mentions(String text) {
        return (root, query, cb) -> {
            if (isBlank(text)) {
                return null;
            }
            String pattern = "%" + text.trim().toLowerCase() + "%";
            return cb.or(
                    cb.like(cb.lower(root.get("patientName")), pattern),
                    cb.like(cb.lower(root.get("hospital")), pattern),
                    cb.like(cb.lower(root.get("description")), pattern));
        };
    }

    static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
