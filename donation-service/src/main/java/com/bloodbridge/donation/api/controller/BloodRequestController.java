package com.bloodbridge.donation.api.controller;

import com.bloodbridge.common.dto.BaseResponse;
import com.bloodbridge.common.dto.PageResponse;
import com.bloodbridge.common.util.Constants;
import com.bloodbridge.donation.api.dto.BloodRequestResponse;
import com.bloodbridge.donation.api.dto.CreateBloodRequestRequest;
import com.bloodbridge.donation.api.dto.RequestStatsResponse;
import com.bloodbridge.donation.api.dto.UpdateBloodRequestRequest;
import com.bloodbridge.donation.domain.model.BloodGroup;
import com.bloodbridge.donation.domain.model.UrgencyLevel;
import com.bloodbridge.donation.domain.service.BloodRequestService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Blood request lifecycle endpoints. The acting user arrives in the {@code X-User-Id} header.
 */
@RestController
@RequestMapping("/api/v1/requests")
@RequiredArgsConstructor
public class BloodRequestController {

    private final BloodRequestService bloodRequestService;

    @PostMapping
    public ResponseEntity<BaseResponse<BloodRequestResponse>> createRequest(
            @RequestHeader(Constants.USER_ID_HEADER) Long userId,
            @Valid @RequestBody CreateBloodRequestRequest request) {
        BloodRequestResponse response = bloodRequestService.createRequest(userId, request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(BaseResponse.success("Blood request created successfully", response));
    }

    @GetMapping
    public ResponseEntity<BaseResponse<PageResponse<BloodRequestResponse>>> listActive(
            @RequestParam(required = false) BloodGroup bloodGroup,
            @RequestParam(required = false) UrgencyLevel urgency,
            @RequestParam(required = false) String city,
            @RequestParam(required = false) String pincode,
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer limit) {
        return ResponseEntity.ok(BaseResponse.success(
                bloodRequestService.listActive(bloodGroup, urgency, city, pincode, page, limit)));
    }

    @GetMapping("/mine")
    public ResponseEntity<BaseResponse<PageResponse<BloodRequestResponse>>> listMine(
            @RequestHeader(Constants.USER_ID_HEADER) Long userId,
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer limit) {
        return ResponseEntity.ok(BaseResponse.success(bloodRequestService.listByRequester(userId, page, limit)));
    }

    @GetMapping("/search")
    public ResponseEntity<BaseResponse<List<BloodRequestResponse>>> search(
            @RequestParam("q") String text,
            @RequestParam(required = false) BloodGroup bloodGroup,
            @RequestParam(required = false) String city) {
        return ResponseEntity.ok(BaseResponse.success(bloodRequestService.search(text, bloodGroup, city)));
    }

    @GetMapping("/stats")
    public ResponseEntity<BaseResponse<RequestStatsResponse>> getStats() {
        return ResponseEntity.ok(BaseResponse.success(bloodRequestService.getRequestStats()));
    }

    @GetMapping("/{id}")
    public ResponseEntity<BaseResponse<BloodRequestResponse>> getRequest(@PathVariable Long id) {
        return ResponseEntity.ok(BaseResponse.success(bloodRequestService.getRequest(id)));
    }

    @PutMapping("/{id}")
    public ResponseEntity<BaseResponse<BloodRequestResponse>> updateRequest(
            @PathVariable Long id,
            @RequestHeader(Constants.USER_ID_HEADER) Long userId,
            @Valid @RequestBody UpdateBloodRequestRequest request) {
        BloodRequestResponse response = bloodRequestService.updateRequest(id, userId, request);
        return ResponseEntity.ok(BaseResponse.success("Blood request updated successfully", response));
    }

    @PostMapping("/{id}/fulfill")
    public ResponseEntity<BaseResponse<BloodRequestResponse>> fulfillRequest(
            @PathVariable Long id,
            @RequestHeader(Constants.USER_ID_HEADER) Long userId) {
        BloodRequestResponse response = bloodRequestService.fulfillRequest(id, userId);
        return ResponseEntity.ok(BaseResponse.success("Blood request fulfilled", response));
    }

    @PostMapping("/{id}/cancel")
    public ResponseEntity<BaseResponse<Void>> cancelRequest(
            @PathVariable Long id,
            @RequestHeader(Constants.USER_ID_HEADER) Long userId) {
        bloodRequestService.cancelRequest(id, userId);
        return ResponseEntity.ok(BaseResponse.success("Blood request cancelled", null));
    }
}
