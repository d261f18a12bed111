package com.bloodbridge.donation.domain.model;

/**
 * Urgency tier of a blood request. Higher priority is served first.
 */
public enum UrgencyLevel {
    CRITICAL(3),
    URGENT(2),
    NORMAL(1);

    private final int priority;

    UrgencyLevel(int priority) {
        this.priority = priority;
    }

    public int getPriority() {
        return priority;
    }
}
