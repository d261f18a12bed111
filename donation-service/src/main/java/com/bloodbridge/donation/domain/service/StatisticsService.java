package com.bloodbridge.donation.domain.service;

import com.bloodbridge.common.exception.ResourceNotFoundException;
import com.bloodbridge.common.util.Constants;
import com.bloodbridge.donation.api.dto.BloodGroupDonationStats;
import com.bloodbridge.donation.api.dto.DonationStatsResponse;
import com.bloodbridge.donation.api.dto.LeaderboardEntry;
import com.bloodbridge.donation.api.dto.UserSummaryResponse;
import com.bloodbridge.donation.config.CacheConfig;
import com.bloodbridge.donation.domain.model.DonationRecord.DonationStatus;
import com.bloodbridge.donation.domain.repository.DonationRecordRepository;
import com.bloodbridge.donation.domain.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Donation statistics. Global views are cached and evicted by {@link DonationService} and
 * {@link UserService} whenever a donation record changes.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StatisticsService {

    private final DonationRecordRepository donationRecordRepository;
    private final UserRepository userRepository;
    private final StatisticsAggregator aggregator;

    @Transactional(readOnly = true)
    @Cacheable(value = CacheConfig.LEADERBOARD, key = "#limit")
    public List<LeaderboardEntry> getLeaderboard(int limit) {
        int size = limit < 1 ? Constants.DEFAULT_LEADERBOARD_SIZE : Math.min(limit, Constants.MAX_LEADERBOARD_SIZE);
        log.debug("Computing leaderboard, top {}", size);
        return aggregator.leaderboard(donationRecordRepository.findByStatus(DonationStatus.COMPLETED), size);
    }

    @Transactional(readOnly = true)
    @Cacheable(value = CacheConfig.DONATION_STATS, key = "'global'")
    public DonationStatsResponse getDonationStats() {
        log.debug("Computing donation statistics");
        return aggregator.donationStats(donationRecordRepository.totalsByStatus());
    }

    @Transactional(readOnly = true)
    @Cacheable(value = CacheConfig.DONATIONS_BY_BLOOD_GROUP, key = "'completed'")
    public List<BloodGroupDonationStats> getDonationsByBloodGroup() {
        return aggregator.donationsByBloodGroup(donationRecordRepository.totalsByBloodGroup(DonationStatus.COMPLETED));
    }

    @Transactional(readOnly = true)
    public UserSummaryResponse getUserSummary(Long userId, boolean completedOnly) {
        if (!userRepository.existsById(userId)) {
            throw new ResourceNotFoundException("User", userId);
        }
        return aggregator.summarize(donationRecordRepository.findByDonorIdOrderByDateDesc(userId), completedOnly);
    }
}
