package com.bloodbridge.donation.config;

import org.springframework.cache.annotation.EnableCaching;
import org.springframework.context.annotation.Configuration;

/**
 * Enables the statistics caches. The same names are declared in {@code spring.cache.cache-names}.
 */
@Configuration
@EnableCaching
public class CacheConfig {

    public static final String LEADERBOARD = "leaderboard";
    public static final String DONATION_STATS = "donationStats";
    public static final String DONATIONS_BY_BLOOD_GROUP = "donationsByBloodGroup";
}
