package uk.gegc.antidote.features.billing.application;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Balance policy, top-up limits and sweeper windows.
 */
@Configuration
@ConfigurationProperties(prefix = "billing")
@Validated
@Data
public class BillingProperties {

    /**
     * A deduction leaving the balance below this value is flagged as low balance.
     */
    private long lowBalanceThreshold = 0L;

    /** Smallest top-up, in credits. */
    @Positive
    private long minTopUp = 1000L;

    /** Largest top-up, in credits. */
    @Positive
    private long maxTopUp = 100000L;

    /**
     * Age after which an unconfirmed purchase is failed by the sweeper.
     */
    @NotNull
    private Duration pendingPurchaseTtl = Duration.ofHours(24);

    @Positive
    private long pendingSweepIntervalMs = 300000L;

    private String reconciliationCron = "0 0 2 * * SUN";
}
