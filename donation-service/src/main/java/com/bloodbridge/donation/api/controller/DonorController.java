package com.bloodbridge.donation.api.controller;

import com.bloodbridge.common.dto.BaseResponse;
import com.bloodbridge.donation.api.dto.UserResponse;
import com.bloodbridge.donation.domain.model.BloodGroup;
import com.bloodbridge.donation.domain.service.DonorMatchingService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/donors")
@RequiredArgsConstructor
public class DonorController {

    private final DonorMatchingService donorMatchingService;

    @GetMapping("/compatible")
    public ResponseEntity<BaseResponse<List<UserResponse>>> findCompatibleDonors(
            @RequestParam BloodGroup bloodGroup,
            @RequestParam(required = false) String city,
            @RequestParam(required = false) String pincode) {
        return ResponseEntity.ok(BaseResponse.success(
                donorMatchingService.findCompatibleDonors(bloodGroup, city, pincode)));
    }
}
