package com.bloodbridge.donation.api.controller;

import com.bloodbridge.common.dto.BaseResponse;
import com.bloodbridge.common.util.Constants;
import com.bloodbridge.donation.api.dto.BloodGroupDonationStats;
import com.bloodbridge.donation.api.dto.DonationStatsResponse;
import com.bloodbridge.donation.api.dto.LeaderboardEntry;
import com.bloodbridge.donation.domain.service.StatisticsService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/stats")
@RequiredArgsConstructor
public class StatisticsController {

    private final StatisticsService statisticsService;

    @GetMapping("/leaderboard")
    public ResponseEntity<BaseResponse<List<LeaderboardEntry>>> getLeaderboard(
            @RequestParam(defaultValue = "" + Constants.DEFAULT_LEADERBOARD_SIZE) int limit) {
        return ResponseEntity.ok(BaseResponse.success(statisticsService.getLeaderboard(limit)));
    }

    @GetMapping("/donations")
    public ResponseEntity<BaseResponse<DonationStatsResponse>> getDonationStats() {
        return ResponseEntity.ok(BaseResponse.success(statisticsService.getDonationStats()));
    }

    @GetMapping("/donations/blood-groups")
    public ResponseEntity<BaseResponse<List<BloodGroupDonationStats>>> getDonationsByBloodGroup() {
        return ResponseEntity.ok(BaseResponse.success(statisticsService.getDonationsByBloodGroup()));
    }
}
