package com.bloodbridge.donation.domain.service;

import com.bloodbridge.donation.api.dto.BloodGroupDonationStats;
import com.bloodbridge.donation.api.dto.DonationStatsResponse;
import com.bloodbridge.donation.api.dto.LeaderboardEntry;
import com.bloodbridge.donation.api.dto.UserStatsResponse;
import com.bloodbridge.donation.api.dto.UserSummaryResponse;
import com.bloodbridge.donation.domain.model.BloodGroup;
import com.bloodbridge.donation.domain.model.DonationRecord;
import com.bloodbridge.donation.domain.model.DonationRecord.DonationStatus;
import com.bloodbridge.donation.domain.policy.EligibilityEvaluator;
import com.bloodbridge.donation.domain.repository.DonationRecordRepository.BloodGroupTotals;
import com.bloodbridge.donation.domain.repository.DonationRecordRepository.StatusTotals;
import com.bloodbridge.donation.domain.repository.UserRepository.BloodGroupCount;
import com.bloodbridge.donation.domain.repository.UserRepository.UserTypeTotals;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-side rollups over donation records and aggregate query rows. Holds no state and writes nothing.
 * <p>
 * Cooldown figures in the per-donor summary come from {@link EligibilityEvaluator} so the summary
 * and the donation gate never disagree.
 */
@Component
@RequiredArgsConstructor
public class StatisticsAggregator {

    static final Comparator<LeaderboardEntry> LEADERBOARD_ORDER = Comparator
            .comparingLong(LeaderboardEntry::totalPoints).reversed()
            .thenComparing(Comparator.comparingLong(LeaderboardEntry::totalDonations).reversed())
            .thenComparing(LeaderboardEntry::donorId);

    private final EligibilityEvaluator eligibilityEvaluator;

    /**
     * Ranks donors over the given records, counting completed ones only.
     */
    public List<LeaderboardEntry> leaderboard(Collection<DonationRecord> records, int limit) {
        Map<Long, DonorTally> tallies = new LinkedHashMap<>();
        for (DonationRecord record : records) {
            if (record.getStatus() != DonationStatus.COMPLETED) {
                continue;
            }
            tallies.computeIfAbsent(record.getDonorId(), id -> new DonorTally(record)).add(record);
        }
        return tallies.values().stream()
                .map(DonorTally::toEntry)
                .sorted(LEADERBOARD_ORDER)
                .limit(limit)
                .toList();
    }

    /**
     * @param completedOnly true for the contribution view (completed records only), false to
     *                      count every record the donor has
     */
    public UserSummaryResponse summarize(Collection<DonationRecord> records, boolean completedOnly) {
        long total = 0;
        long completed = 0;
        long units = 0;
        long points = 0;
        LocalDateTime first = null;
        LocalDateTime last = null;

        for (DonationRecord record : records) {
            boolean isCompleted = record.getStatus() == DonationStatus.COMPLETED;
            if (completedOnly && !isCompleted) {
                continue;
            }
            total++;
            if (isCompleted) {
                completed++;
            }
            units += record.getUnitsContributed();
            points += record.getPoints();
            if (first == null || record.getDate().isBefore(first)) {
                first = record.getDate();
            }
            if (last == null || record.getDate().isAfter(last)) {
                last = record.getDate();
            }
        }

        double average = total == 0 ? 0.0 : Math.round(points * 100.0 / total) / 100.0;
        return new UserSummaryResponse(
                total,
                completed,
                units,
                points,
                average,
                last,
                first,
                eligibilityEvaluator.daysSince(last),
                eligibilityEvaluator.isCooledDown(last)
        );
    }

    public DonationStatsResponse donationStats(Collection<? extends StatusTotals> rows) {
        long total = 0;
        long completed = 0;
        long pending = 0;
        long cancelled = 0;
        long units = 0;
        long points = 0;

        for (StatusTotals row : rows) {
            long count = nullToZero(row.getTotal());
            total += count;
            units += nullToZero(row.getUnits());
            points += nullToZero(row.getPoints());
            switch (row.getStatus()) {
                case COMPLETED -> completed += count;
                case PENDING -> pending += count;
                case CANCELLED -> cancelled += count;
            }
        }
        return new DonationStatsResponse(total, completed, pending, cancelled, units, points);
    }

    public List<BloodGroupDonationStats> donationsByBloodGroup(Collection<? extends BloodGroupTotals> rows) {
        return rows.stream()
                .map(row -> new BloodGroupDonationStats(
                        row.getBloodGroup(),
                        nullToZero(row.getTotal()),
                        nullToZero(row.getUnits()),
                        nullToZero(row.getPoints())))
                .sorted(Comparator.comparingLong(BloodGroupDonationStats::count).reversed()
                        .thenComparing(BloodGroupDonationStats::bloodGroup))
                .toList();
    }

    public UserStatsResponse userStats(Collection<? extends UserTypeTotals> typeRows,
                                       Collection<? extends BloodGroupCount> donorGroups) {
        long totalUsers = 0;
        long donors = 0;
        long patients = 0;
        long hospitals = 0;
        long availableDonors = 0;
        long verified = 0;

        for (UserTypeTotals row : typeRows) {
            long count = nullToZero(row.getTotal());
            totalUsers += count;
            verified += nullToZero(row.getVerified());
            switch (row.getUserType()) {
                case DONOR -> {
                    donors += count;
                    availableDonors += nullToZero(row.getAvailable());
                }
                case PATIENT -> patients += count;
                case HOSPITAL -> hospitals += count;
            }
        }

        List<UserStatsResponse.BloodGroupShare> distribution = donorGroups.stream()
                .map(row -> new UserStatsResponse.BloodGroupShare(row.getBloodGroup(), nullToZero(row.getTotal())))
                .sorted(Comparator.comparingLong(UserStatsResponse.BloodGroupShare::count).reversed()
                        .thenComparing(UserStatsResponse.BloodGroupShare::bloodGroup))
                .toList();

        return new UserStatsResponse(totalUsers, donors, patients, hospitals, availableDonors, verified, distribution);
    }

    private static long nullToZero(Long value) {
        return value == null ? 0L : value;
    }

    private static final class DonorTally {
        private final Long donorId;
        private final String name;
        private final BloodGroup bloodGroup;
        private long donations;
        private long units;
        private long points;
        private LocalDateTime lastDonation;

        DonorTally(DonationRecord seed) {
            this.donorId = seed.getDonorId();
            this.name = seed.getDonorName();
            this.bloodGroup = seed.getBloodGroup();
        }

        DonorTally add(DonationRecord record) {
            donations++;
            units += record.getUnitsContributed();
            points += record.getPoints();
            if (lastDonation == null || record.getDate().isAfter(lastDonation)) {
                lastDonation = record.getDate();
            }
            return this;
        }

        LeaderboardEntry toEntry() {
            return new LeaderboardEntry(donorId, name, bloodGroup, donations, units, points, lastDonation);
        }
    }
}
