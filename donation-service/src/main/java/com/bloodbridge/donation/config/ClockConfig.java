package com.bloodbridge.donation.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Every "now" in the domain comes from this clock; tests replace it with a fixed or mutable one.
 * It runs in UTC, matching the JDBC time zone, so local timestamps never jump at DST changes.
 */
@Configuration
public class ClockConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
