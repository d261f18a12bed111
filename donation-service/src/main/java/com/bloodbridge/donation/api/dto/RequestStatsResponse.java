package com.bloodbridge.donation.api.dto;

/**
 * Request counts by status and by urgency tier. {@code active} counts only non-expired requests.
 */
public record RequestStatsResponse(
        long total,
        long active,
        long fulfilled,
        long expired,
        long cancelled,
        long critical,
        long urgent,
        long normal
) {
}
