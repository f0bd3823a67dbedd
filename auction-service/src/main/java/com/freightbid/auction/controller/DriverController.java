package com.freightbid.auction.controller;

import com.freightbid.auction.model.DriverLocationRequest;
import com.freightbid.auction.model.DriverProfileResponse;
import com.freightbid.auction.service.DriverProfileService;
import com.freightbid.shared.dto.ApiResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/drivers")
@RequiredArgsConstructor
public class DriverController {

    private final DriverProfileService driverProfileService;

    @PutMapping("/{driverId}/location")
    public ResponseEntity<ApiResponse<DriverProfileResponse>> updateLocation(
            @PathVariable("driverId") String driverId,
            @Valid @RequestBody DriverLocationRequest request) {

        return ResponseEntity.ok(ApiResponse.ok(
                DriverProfileResponse.from(driverProfileService.updateLocation(driverId, request))));
    }

    @GetMapping("/{driverId}")
    public ResponseEntity<ApiResponse<DriverProfileResponse>> getProfile(@PathVariable("driverId") String driverId) {
        return ResponseEntity.ok(ApiResponse.ok(DriverProfileResponse.from(driverProfileService.getProfile(driverId))));
    }
}
