package com.raffleapp.raffle.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Raffle parameters. Bound once at startup and never changed afterwards.
 */
@Getter
@Setter
@Validated
@ConfigurationProperties("raffle")
public class RaffleProperties {

    public static final int REQUEST_CONFIRMATIONS = 3;
    public static final int NUM_WORDS = 1;

    @NotNull
    @DecimalMin(value = "0", inclusive = false)
    private BigDecimal entranceFee = new BigDecimal("0.01");

    @NotNull
    private Duration interval = Duration.ofSeconds(30);

    @Valid
    private Oracle oracle = new Oracle();

    @Valid
    private Payout payout = new Payout();

    @Valid
    private Keeper keeper = new Keeper();

    @AssertTrue(message = "raffle.interval must be positive")
    public boolean isIntervalPositive() {
        return interval != null && !interval.isNegative() && !interval.isZero();
    }

    @AssertTrue(message = "raffle.oracle.callback-key is required when raffle.oracle.mode=http")
    public boolean isCallbackKeyConfiguredForHttpOracle() {
        if (oracle == null || !"http".equalsIgnoreCase(oracle.getMode())) return true;
        return oracle.getCallbackKey() != null && !oracle.getCallbackKey().isBlank();
    }

    @Getter
    @Setter
    public static class Oracle {
        // local | http
        private String mode = "local";
        private String endpoint;
        private String apiKey;
        private String gasLane = "0x474e34a077df58807dbe9c96d3c009b23b3c6d0cce433e59bbf5b34f823bc56c";
        private long subscriptionId;
        @Min(1)
        private long callbackGasLimit = 500_000L;
        // shared secret the oracle presents on the fulfillment callback; blank closes the endpoint
        private String callbackKey;
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration requestTimeout = Duration.ofSeconds(25);
        @Valid
        private Local local = new Local();
    }

    @Getter
    @Setter
    public static class Local {
        private boolean autoFulfill = true;
        private Duration blockTime = Duration.ofSeconds(1);
    }

    @Getter
    @Setter
    public static class Payout {
        // ledger | http
        private String mode = "ledger";
        private String endpoint;
        private String apiKey;
        private Duration requestTimeout = Duration.ofSeconds(25);
    }

    @Getter
    @Setter
    public static class Keeper {
        private boolean enabled = false;
        @Min(100)
        private long pollDelayMs = 5_000L;
    }
}
