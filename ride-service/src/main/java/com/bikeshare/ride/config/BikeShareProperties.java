package com.bikeshare.ride.config;

import com.bikeshare.ride.model.FareMode;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Typed view of the {@code bikeshare.*} block in application.yml.
 */
@Data
@ConfigurationProperties(prefix = "bikeshare")
public class BikeShareProperties {

    private Ride ride = new Ride();
    private Fare fare = new Fare();
    private Pricing pricing = new Pricing();
    private Gps gps = new Gps();
    private Flags flags = new Flags();

    @Data
    public static class Ride {
        /** Wallet balance a rider needs before a bike is unlocked. */
        private BigDecimal minimumStartBalance = new BigDecimal("5.00");
        private Duration lockWait = Duration.ofSeconds(2);
        private Duration lockLease = Duration.ofSeconds(10);
    }

    @Data
    public static class Fare {
        private FareMode mode = FareMode.FLAT;
        private BigDecimal perMinuteRate = new BigDecimal("0.50");
        private BigDecimal unlockFee = new BigDecimal("1.00");
        /** Plan used in PRICING_RESOLVER mode; first active plan when blank. */
        private String planName;
    }

    @Data
    public static class Pricing {
        /** Zone in which pricing rule hours and day-of-week are evaluated. */
        private String zone;
    }

    @Data
    public static class Gps {
        /** Base URL of the GPS tracking service; trace lookups are skipped when blank. */
        private String baseUrl;
        private Duration timeout = Duration.ofSeconds(3);
    }

    @Data
    public static class Flags {
        /** Seed missing flag defaults into Redis once the service is up. */
        private boolean seedOnStartup = true;
        /** Tenants whose flag hashes are seeded. */
        private List<String> tenants = new ArrayList<>(List.of("default"));
    }
}
