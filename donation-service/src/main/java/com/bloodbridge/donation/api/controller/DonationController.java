package com.bloodbridge.donation.api.controller;

import com.bloodbridge.common.dto.BaseResponse;
import com.bloodbridge.common.dto.PageResponse;
import com.bloodbridge.common.util.Constants;
import com.bloodbridge.donation.api.dto.CreateDonationRequest;
import com.bloodbridge.donation.api.dto.DonationResponse;
import com.bloodbridge.donation.api.dto.UpdateDonationRequest;
import com.bloodbridge.donation.domain.model.BloodGroup;
import com.bloodbridge.donation.domain.model.DonationRecord.DonationStatus;
import com.bloodbridge.donation.domain.service.DonationService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/donations")
@RequiredArgsConstructor
public class DonationController {

    private final DonationService donationService;

    @PostMapping
    public ResponseEntity<BaseResponse<DonationResponse>> createDonation(
            @RequestHeader(Constants.USER_ID_HEADER) Long userId,
            @Valid @RequestBody CreateDonationRequest request) {
        DonationResponse response = donationService.createDonation(userId, request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(BaseResponse.success("Donation recorded successfully", response));
    }

    @GetMapping
    public ResponseEntity<BaseResponse<PageResponse<DonationResponse>>> listDonations(
            @RequestParam(required = false) DonationStatus status,
            @RequestParam(required = false) BloodGroup bloodGroup,
            @RequestParam(required = false) String city,
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer limit) {
        return ResponseEntity.ok(BaseResponse.success(
                donationService.listDonations(status, bloodGroup, city, page, limit)));
    }

    @GetMapping("/mine")
    public ResponseEntity<BaseResponse<PageResponse<DonationResponse>>> listMine(
            @RequestHeader(Constants.USER_ID_HEADER) Long userId,
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer limit) {
        return ResponseEntity.ok(BaseResponse.success(donationService.listByDonor(userId, page, limit)));
    }

    @GetMapping("/{id}")
    public ResponseEntity<BaseResponse<DonationResponse>> getDonation(@PathVariable Long id) {
        return ResponseEntity.ok(BaseResponse.success(donationService.getDonation(id)));
    }

    @PutMapping("/{id}")
    public ResponseEntity<BaseResponse<DonationResponse>> updateDonation(
            @PathVariable Long id,
            @RequestHeader(Constants.USER_ID_HEADER) Long userId,
            @Valid @RequestBody UpdateDonationRequest request) {
        DonationResponse response = donationService.updateDonation(id, userId, request);
        return ResponseEntity.ok(BaseResponse.success("Donation updated successfully", response));
    }

    @PostMapping("/{id}/complete")
    public ResponseEntity<BaseResponse<DonationResponse>> completeDonation(
            @PathVariable Long id,
            @RequestHeader(Constants.USER_ID_HEADER) Long userId) {
        DonationResponse response = donationService.completeDonation(id, userId);
        return ResponseEntity.ok(BaseResponse.success("Donation completed", response));
    }

    @PostMapping("/{id}/cancel")
    public ResponseEntity<BaseResponse<Void>> cancelDonation(
            @PathVariable Long id,
            @RequestHeader(Constants.USER_ID_HEADER) Long userId) {
        donationService.cancelDonation(id, userId);
        return ResponseEntity.ok(BaseResponse.success("Donation cancelled", null));
    }
}
