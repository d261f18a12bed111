package com.bloodbridge.donation.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * ABO/Rh blood group. Serialized and stored with its conventional label ("A+", "O-", ...).
 */
public enum BloodGroup {
    A_POS("A+"),
    A_NEG("A-"),
    B_POS("B+"),
    B_NEG("B-"),
    AB_POS("AB+"),
    AB_NEG("AB-"),
    O_POS("O+"),
    O_NEG("O-");

    private final String label;

    BloodGroup(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public boolean isRhPositive() {
        return label.endsWith("+");
    }

    /**
     * Accepts either the label ("AB+") or the constant name ("AB_POS"), case-insensitive.
     */
    @JsonCreator
    public static BloodGroup fromValue(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toUpperCase();
        return Arrays.stream(values())
                .filter(g -> g.label.equals(normalized) || g.name().equals(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown blood group: " + value));
    }

    @Override
    public String toString() {
        return label;
    }
}
