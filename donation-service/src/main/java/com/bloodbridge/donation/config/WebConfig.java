package com.bloodbridge.donation.config;

import com.bloodbridge.donation.domain.model.BloodGroup;
import com.bloodbridge.donation.domain.model.DonationRecord.DonationStatus;
import com.bloodbridge.donation.domain.model.UrgencyLevel;
import com.bloodbridge.donation.domain.model.UserType;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.convert.converter.Converter;
import org.springframework.format.FormatterRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Query-parameter binding for the domain enums: case-insensitive names, and blood-group labels
 * such as {@code bloodGroup=O%2B}.
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    @Override
    public void addFormatters(FormatterRegistry registry) {
        registry.addConverter(String.class, BloodGroup.class, BloodGroup::fromValue);
        registry.addConverter(String.class, UrgencyLevel.class, caseInsensitive(UrgencyLevel.class));
        registry.addConverter(String.class, UserType.class, caseInsensitive(UserType.class));
        registry.addConverter(String.class, DonationStatus.class, caseInsensitive(DonationStatus.class));
    }

    static <E extends Enum<E>> Converter<String, E> caseInsensitive(Class<E> type) {
        return source -> source.isBlank() ? null : Enum.valueOf(type, source.trim().toUpperCase());
    }
}
