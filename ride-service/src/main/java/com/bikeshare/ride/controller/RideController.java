package com.bikeshare.ride.controller;

import com.bikeshare.ride.model.EndRideRequest;
import com.bikeshare.ride.model.RideResponse;
import com.bikeshare.ride.model.RideStats;
import com.bikeshare.ride.model.StartRideRequest;
import com.bikeshare.ride.service.RideService;
import com.bikeshare.shared.dto.ApiResponse;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@Validated
@RestController
@RequestMapping("/api/v1/rides")
@RequiredArgsConstructor
public class RideController {

    private final RideService rideService;

    @PostMapping
    public ResponseEntity<ApiResponse<RideResponse>> startRide(@Valid @RequestBody StartRideRequest request) {
        RideResponse ride = RideResponse.from(rideService.startRide(request));
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.ok(ride));
    }

    @PostMapping("/{rideId}/end")
    public ResponseEntity<ApiResponse<RideResponse>> endRide(
            @PathVariable("rideId") UUID rideId,
            @Valid @RequestBody EndRideRequest request) {

        return ResponseEntity.ok(ApiResponse.ok(RideResponse.from(rideService.endRide(rideId, request))));
    }

    @PostMapping("/{rideId}/cancel")
    public ResponseEntity<ApiResponse<RideResponse>> cancelRide(
            @PathVariable("rideId") UUID rideId,
            @RequestParam("riderId") String riderId) {

        return ResponseEntity.ok(ApiResponse.ok(RideResponse.from(rideService.cancelRide(rideId, riderId))));
    }

    @GetMapping("/{rideId}")
    public ResponseEntity<ApiResponse<RideResponse>> getRide(@PathVariable("rideId") UUID rideId) {
        return ResponseEntity.ok(ApiResponse.ok(RideResponse.from(rideService.getRide(rideId))));
    }

    /** 200 with no data when the rider has no ride in progress. */
    @GetMapping("/active")
    public ResponseEntity<ApiResponse<RideResponse>> getActiveRide(@RequestParam("riderId") String riderId) {
        return ResponseEntity.ok(ApiResponse.ok(rideService.getActiveRide(riderId).map(RideResponse::from).orElse(null)));
    }

    @GetMapping
    public ResponseEntity<ApiResponse<Page<RideResponse>>> getRiderRides(
            @RequestParam("riderId") String riderId,
            @RequestParam(value = "page", defaultValue = "0") @Min(0) int page,
            @RequestParam(value = "size", defaultValue = "20") @Min(1) @Max(100) int size) {

        return ResponseEntity.ok(ApiResponse.ok(rideService.getRiderRides(riderId, page, size).map(RideResponse::from)));
    }

    @GetMapping("/stats")
    public ResponseEntity<ApiResponse<RideStats>> getRideStats(@RequestParam("riderId") String riderId) {
        return ResponseEntity.ok(ApiResponse.ok(rideService.getRideStats(riderId)));
    }
}
