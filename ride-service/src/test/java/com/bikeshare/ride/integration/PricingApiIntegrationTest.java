package com.bikeshare.ride.integration;

import com.bikeshare.ride.RideServiceApplication;
import com.bikeshare.ride.entity.PricingPlan.PlanType;
import com.bikeshare.ride.entity.Promotion.DiscountType;
import com.bikeshare.ride.model.PricingConfigRequest;
import com.bikeshare.ride.model.PromotionRequest;
import com.bikeshare.ride.service.GpsTrackProvider;
import com.bikeshare.ride.service.NotificationSink;
import com.bikeshare.shared.featureflag.FeatureFlagService;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.redisson.api.RedissonClient;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Pricing administration, wallet and error mapping through the REST layer.
 *
 * The clock is pinned to Wednesday 2024-05-01 10:00 UTC.
 */
@SpringBootTest(classes = {RideServiceApplication.class, TestClockConfig.class})
@AutoConfigureMockMvc
@ActiveProfiles("test")
class PricingApiIntegrationTest {

    @MockBean private RedissonClient redissonClient;
    @MockBean private FeatureFlagService featureFlagService;
    @MockBean private GpsTrackProvider gpsTrackProvider;
    @MockBean private NotificationSink notificationSink;

    @Autowired private MockMvc mockMvc;
    @Autowired private ObjectMapper objectMapper;

    private static PricingConfigRequest.Plan plan(String name, String hourly) {
        return PricingConfigRequest.Plan.builder()
                .name(name)
                .planType(PlanType.HOURLY)
                .hourlyRate(new BigDecimal(hourly))
                .dailyRate(new BigDecimal("1000"))
                .weeklyRate(new BigDecimal("5000"))
                .monthlyRate(new BigDecimal("15000"))
                .build();
    }

    private JsonNode putConfig() throws Exception {
        PricingConfigRequest request = PricingConfigRequest.builder()
                .unlockFee(new BigDecimal("1.00"))
                .baseHourlyRate(new BigDecimal("200"))
                .plans(List.of(plan("Hourly", "200"), plan("Student", "100")))
                .rules(List.of(PricingConfigRequest.Rule.builder()
                        .name("Wednesday Rush")
                        .dayOfWeek(3)
                        .startHour(7)
                        .endHour(10)
                        .multiplier(new BigDecimal("1.5"))
                        .priority(10)
                        .build()))
                .build();

        MvcResult result = mockMvc.perform(put("/api/v1/pricing/config")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.plans", hasSize(2)))
                .andReturn();
        return objectMapper.readTree(result.getResponse().getContentAsString()).path("data");
    }

    private String createPromotion(UUID planId, String name, Integer usageLimit) throws Exception {
        PromotionRequest request = PromotionRequest.builder()
                .name(name)
                .discountType(DiscountType.PERCENTAGE)
                .discountValue(new BigDecimal("20"))
                .startDate(Instant.parse("2024-04-01T00:00:00Z"))
                .endDate(Instant.parse("2024-06-01T00:00:00Z"))
                .usageLimit(usageLimit)
                .planIds(List.of(planId))
                .build();

        MvcResult result = mockMvc.perform(post("/api/v1/pricing/promotions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.data.usageCount").value(0))
                .andReturn();
        return objectMapper.readTree(result.getResponse().getContentAsString()).path("data").path("id").asText();
    }

    @Test
    @DisplayName("Rush-hour rule and a 20% promotion shape the rates until the promotion is used up")
    void configurePromoteAndRedeem() throws Exception {
        JsonNode config = putConfig();
        UUID hourlyPlanId = UUID.fromString(config.path("plans").get(0).path("id").asText());

        mockMvc.perform(get("/api/v1/pricing/current").param("date", "2024-05-01").param("hour", "8"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.appliedRule").value("Wednesday Rush"))
                .andExpect(jsonPath("$.data.plans[0].name").value("Hourly"))
                .andExpect(jsonPath("$.data.plans[0].hourlyRate").value(300))
                .andExpect(jsonPath("$.data.plans[1].hourlyRate").value(150))
                .andExpect(jsonPath("$.data.nextUpdate", startsWith("2024-05-01T09:00")));

        String promotionId = createPromotion(hourlyPlanId, "Spring20", 2);

        mockMvc.perform(get("/api/v1/pricing/current").param("date", "2024-05-01").param("hour", "8"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.plans[0].hourlyRate").value(240))
                .andExpect(jsonPath("$.data.plans[0].originalHourlyRate").value(200))
                .andExpect(jsonPath("$.data.plans[1].hourlyRate").value(150))
                .andExpect(jsonPath("$.data.appliedPromotions[0]").value("Spring20"));

        mockMvc.perform(post("/api/v1/pricing/promotions/{id}/redeem", promotionId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.usageCount").value(1));
        mockMvc.perform(post("/api/v1/pricing/promotions/{id}/redeem", promotionId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.usageCount").value(2));
        mockMvc.perform(post("/api/v1/pricing/promotions/{id}/redeem", promotionId))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.errorCode").value("PROMOTION_NOT_REDEEMABLE"));

        // Used up: the discount no longer applies.
        mockMvc.perform(get("/api/v1/pricing/current").param("date", "2024-05-01").param("hour", "8"))
                .andExpect(jsonPath("$.data.plans[0].hourlyRate").value(300))
                .andExpect(jsonPath("$.data.appliedPromotions", hasSize(0)));

        // Outside the rule window only the promotion-free base rate remains.
        mockMvc.perform(get("/api/v1/pricing/current").param("date", "2024-05-01").param("hour", "10"))
                .andExpect(jsonPath("$.data.plans[0].hourlyRate").value(200));
    }

    @Test
    @DisplayName("Promotion referencing a plan of no configuration is rejected with PRICING_PLAN_NOT_FOUND")
    void promotionForUnknownPlan() throws Exception {
        putConfig();
        PromotionRequest request = PromotionRequest.builder()
                .name("Ghost")
                .discountType(DiscountType.FIXED_AMOUNT)
                .discountValue(new BigDecimal("10"))
                .startDate(Instant.parse("2024-04-01T00:00:00Z"))
                .endDate(Instant.parse("2024-06-01T00:00:00Z"))
                .planIds(List.of(UUID.randomUUID()))
                .build();

        mockMvc.perform(post("/api/v1/pricing/promotions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.errorCode").value("PRICING_PLAN_NOT_FOUND"));
    }

    @Test
    @DisplayName("Promotion ending before it starts is rejected with INVALID_TIME_RANGE")
    void promotionWithInvertedDates() throws Exception {
        putConfig();
        PromotionRequest request = PromotionRequest.builder()
                .name("Backwards")
                .discountType(DiscountType.PERCENTAGE)
                .discountValue(new BigDecimal("10"))
                .startDate(Instant.parse("2024-06-01T00:00:00Z"))
                .endDate(Instant.parse("2024-04-01T00:00:00Z"))
                .build();

        mockMvc.perform(post("/api/v1/pricing/promotions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("INVALID_TIME_RANGE"));
    }

    @Test
    @DisplayName("Rule whose start and end hour are equal is rejected and the stored config is kept")
    void ruleWithEmptyHourWindow() throws Exception {
        putConfig();
        PricingConfigRequest request = PricingConfigRequest.builder()
                .unlockFee(new BigDecimal("1.00"))
                .baseHourlyRate(new BigDecimal("200"))
                .plans(List.of(plan("Hourly", "200")))
                .rules(List.of(PricingConfigRequest.Rule.builder()
                        .name("Midnight")
                        .startHour(0)
                        .endHour(0)
                        .multiplier(new BigDecimal("2.0"))
                        .build()))
                .build();

        mockMvc.perform(put("/api/v1/pricing/config")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("INVALID_TIME_RANGE"));

        mockMvc.perform(get("/api/v1/pricing/current").param("date", "2024-05-01").param("hour", "8"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.appliedRule").value("Wednesday Rush"))
                .andExpect(jsonPath("$.data.plans", hasSize(2)));
    }

    @Test
    @DisplayName("Hour outside 0-23 is a validation failure")
    void hourOutOfRange() throws Exception {
        mockMvc.perform(get("/api/v1/pricing/current").param("hour", "24"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("VALIDATION_FAILED"));
    }

    @Test
    @DisplayName("Top-up through the API credits the wallet and keeps the ledger consistent")
    void walletTopUp() throws Exception {
        String rider = "rider-" + UUID.randomUUID();

        mockMvc.perform(get("/api/v1/wallets/{riderId}", rider))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.balance").value(0));

        mockMvc.perform(post("/api/v1/wallets/{riderId}/top-up", rider)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"amount\": 12.50}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.balance").value(12.5));

        mockMvc.perform(get("/api/v1/wallets/{riderId}/transactions", rider))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.content", hasSize(1)))
                .andExpect(jsonPath("$.data.content[0].type").value("DEPOSIT"))
                .andExpect(jsonPath("$.data.content[0].paymentMethod").value("CARD"));

        MvcResult result = mockMvc.perform(get("/api/v1/wallets/{riderId}/reconciliation", rider))
                .andExpect(status().isOk())
                .andReturn();
        JsonNode reconciliation = objectMapper.readTree(result.getResponse().getContentAsString()).path("data");
        assertThat(reconciliation.path("consistent").asBoolean()).isTrue();
        assertThat(reconciliation.path("balance").decimalValue()).isEqualByComparingTo("12.50");
    }

    @Test
    @DisplayName("Non-positive top-up is rejected")
    void zeroTopUp() throws Exception {
        mockMvc.perform(post("/api/v1/wallets/{riderId}/top-up", "rider-zero")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"amount\": 0}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("VALIDATION_FAILED"));
    }

    @Test
    @DisplayName("Start request without a rider id is a validation failure")
    void startWithoutRider() throws Exception {
        mockMvc.perform(post("/api/v1/rides")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"bikeId\": \"" + UUID.randomUUID() + "\", \"latitude\": 48.85, \"longitude\": 2.35}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("VALIDATION_FAILED"));
    }

    @Test
    @DisplayName("Unknown ride id maps to 404 RIDE_NOT_FOUND")
    void unknownRide() throws Exception {
        mockMvc.perform(get("/api/v1/rides/{rideId}", UUID.randomUUID()))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.errorCode").value("RIDE_NOT_FOUND"));
    }
}
