package com.bloodbridge.donation.api.controller;

import com.bloodbridge.common.dto.BaseResponse;
import com.bloodbridge.common.dto.PageResponse;
import com.bloodbridge.common.util.Constants;
import com.bloodbridge.donation.api.dto.DonationResponse;
import com.bloodbridge.donation.api.dto.RegisterUserRequest;
import com.bloodbridge.donation.api.dto.UpdateAvailabilityRequest;
import com.bloodbridge.donation.api.dto.UserResponse;
import com.bloodbridge.donation.api.dto.UserStatsResponse;
import com.bloodbridge.donation.api.dto.UserSummaryResponse;
import com.bloodbridge.donation.domain.model.BloodGroup;
import com.bloodbridge.donation.domain.model.UserType;
import com.bloodbridge.donation.domain.service.DonationService;
import com.bloodbridge.donation.domain.service.StatisticsService;
import com.bloodbridge.donation.domain.service.UserService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/users")
@RequiredArgsConstructor
public class UserController {

    private final UserService userService;
    private final StatisticsService statisticsService;
    private final DonationService donationService;

    @PostMapping
    public ResponseEntity<BaseResponse<UserResponse>> register(@Valid @RequestBody RegisterUserRequest request) {
        UserResponse response = userService.register(request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(BaseResponse.success("User registered successfully", response));
    }

    @GetMapping
    public ResponseEntity<BaseResponse<PageResponse<UserResponse>>> listUsers(
            @RequestParam(required = false) UserType userType,
            @RequestParam(required = false) BloodGroup bloodGroup,
            @RequestParam(required = false) String city,
            @RequestParam(required = false) String pincode,
            @RequestParam(required = false) Boolean available,
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer limit) {
        return ResponseEntity.ok(BaseResponse.success(
                userService.listUsers(userType, bloodGroup, city, pincode, available, page, limit)));
    }

    @GetMapping("/stats")
    public ResponseEntity<BaseResponse<UserStatsResponse>> getUserStats() {
        return ResponseEntity.ok(BaseResponse.success(userService.getUserStats()));
    }

    @GetMapping("/me/donations")
    public ResponseEntity<BaseResponse<PageResponse<DonationResponse>>> getMyDonations(
            @RequestHeader(Constants.USER_ID_HEADER) Long userId,
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer limit) {
        return ResponseEntity.ok(BaseResponse.success(donationService.listByDonor(userId, page, limit)));
    }

    @PatchMapping("/me/availability")
    public ResponseEntity<BaseResponse<UserResponse>> updateAvailability(
            @RequestHeader(Constants.USER_ID_HEADER) Long userId,
            @Valid @RequestBody UpdateAvailabilityRequest request) {
        UserResponse response = userService.updateAvailability(userId, request.available());
        return ResponseEntity.ok(BaseResponse.success("Availability updated", response));
    }

    @DeleteMapping("/me")
    public ResponseEntity<BaseResponse<Void>> deleteAccount(@RequestHeader(Constants.USER_ID_HEADER) Long userId) {
        userService.deleteAccount(userId);
        return ResponseEntity.ok(BaseResponse.success("Account deleted", null));
    }

    @GetMapping("/{id}")
    public ResponseEntity<BaseResponse<UserResponse>> getUser(@PathVariable Long id) {
        return ResponseEntity.ok(BaseResponse.success(userService.getUser(id)));
    }

    @GetMapping("/{id}/summary")
    public ResponseEntity<BaseResponse<UserSummaryResponse>> getUserSummary(
            @PathVariable Long id,
            @RequestParam(defaultValue = "false") boolean completedOnly) {
        return ResponseEntity.ok(BaseResponse.success(statisticsService.getUserSummary(id, completedOnly)));
    }
}
