package com.bloodbridge.donation.config;

import com.bloodbridge.donation.domain.model.UrgencyLevel;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Single source of truth for the donation rules.
 *
 * <pre>{@code
 * bloodbridge:
 *   rules:
 *     cooldown-days: 90
 *     ttl:
 *       critical: 24h
 *       urgent: 72h
 *       normal: 7d
 *     points:
 *       base: 50
 *       request-bonus: 25
 *       extra-unit: 25
 * }</pre>
 *
 * The eligibility check and the per-donor summary both read {@link #cooldownDays()}.
 */
@ConfigurationProperties(prefix = "bloodbridge.rules")
public record DonationRulesProperties(
        @DefaultValue("90") int cooldownDays,
        @DefaultValue Ttl ttl,
        @DefaultValue Points points) {

    public DonationRulesProperties {
        if (cooldownDays < 0) {
            throw new IllegalArgumentException(
                    "bloodbridge.rules.cooldown-days must not be negative, got: " + cooldownDays);
        }
    }

    public static DonationRulesProperties defaults() {
        return new DonationRulesProperties(90, Ttl.defaults(), Points.defaults());
    }

    public Duration ttlFor(UrgencyLevel urgency) {
        return switch (urgency) {
            case CRITICAL -> ttl.critical();
            case URGENT -> ttl.urgent();
            case NORMAL -> ttl.normal();
        };
    }

    public record Ttl(
            @DefaultValue("24h") Duration critical,
            @DefaultValue("72h") Duration urgent,
            @DefaultValue("7d") Duration normal) {

        public static Ttl defaults() {
            return new Ttl(Duration.ofHours(24), Duration.ofHours(72), Duration.ofDays(7));
        }
    }

    public record Points(
            @DefaultValue("50") int base,
            @DefaultValue("25") int requestBonus,
            @DefaultValue("25") int extraUnit) {

        public Points {
            if (base < 0 || requestBonus < 0 || extraUnit < 0) {
                throw new IllegalArgumentException("bloodbridge.rules.points values must not be negative");
            }
        }

        public static Points defaults() {
            return new Points(50, 25, 25);
        }
    }
}
