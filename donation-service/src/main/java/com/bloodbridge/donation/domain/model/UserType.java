package com.bloodbridge.donation.domain.model;

public enum UserType {
    DONOR,
    PATIENT,
    HOSPITAL
}
