package com.bloodbridge.donation.domain.model;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Stores {@link BloodGroup} as its label so the column reads "A+" rather than "A_POS".
 */
@Converter(autoApply = true)
public class BloodGroupConverter implements AttributeConverter<BloodGroup, String> {

    @Override
    public String convertToDatabaseColumn(BloodGroup attribute) {
        return attribute == null ? null : attribute.getLabel();
    }

    @Override
    public BloodGroup convertToEntityAttribute(String dbData) {
        return dbData == null ? null : BloodGroup.fromValue(dbData);
    }
}
