package com.bikeshare.ride.controller;

import com.bikeshare.ride.model.PricingConfigRequest;
import com.bikeshare.ride.model.PricingConfigResponse;
import com.bikeshare.ride.model.PricingSnapshot;
import com.bikeshare.ride.model.PromotionRequest;
import com.bikeshare.ride.model.PromotionResponse;
import com.bikeshare.ride.service.PricingAdminService;
import com.bikeshare.ride.service.PricingService;
import com.bikeshare.ride.service.PromotionService;
import com.bikeshare.shared.dto.ApiResponse;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Validated
@RestController
@RequestMapping("/api/v1/pricing")
@RequiredArgsConstructor
public class PricingController {

    private final PricingService pricingService;
    private final PricingAdminService adminService;
    private final PromotionService promotionService;

    @GetMapping("/current")
    public ResponseEntity<ApiResponse<PricingSnapshot>> currentPricing(
            @RequestParam(value = "date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @RequestParam(value = "hour", required = false) @Min(0) @Max(23) Integer hour) {

        return ResponseEntity.ok(ApiResponse.ok(pricingService.resolvePricing(date, hour)));
    }

    @PutMapping("/config")
    public ResponseEntity<ApiResponse<PricingConfigResponse>> upsertConfig(@Valid @RequestBody PricingConfigRequest request) {
        return ResponseEntity.ok(ApiResponse.ok(adminService.upsertConfig(request)));
    }

    @GetMapping("/promotions")
    public ResponseEntity<ApiResponse<List<PromotionResponse>>> listPromotions() {
        return ResponseEntity.ok(ApiResponse.ok(adminService.listPromotions()));
    }

    @PostMapping("/promotions")
    public ResponseEntity<ApiResponse<PromotionResponse>> createPromotion(@Valid @RequestBody PromotionRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.ok(adminService.createPromotion(request)));
    }

    @PostMapping("/promotions/{promotionId}/redeem")
    public ResponseEntity<ApiResponse<PromotionResponse>> redeem(@PathVariable("promotionId") UUID promotionId) {
        return ResponseEntity.ok(ApiResponse.ok(promotionService.redeem(promotionId)));
    }
}
