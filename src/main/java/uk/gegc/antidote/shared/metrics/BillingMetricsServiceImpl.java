package uk.gegc.antidote.shared.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Micrometer-backed billing counters. Per-clinic detail goes to debug logs rather than tags to keep
 * metric cardinality bounded.
 */
@Slf4j
@Service
public class BillingMetricsServiceImpl implements BillingMetricsService {

    private final MeterRegistry meterRegistry;

    private final Counter leadDeductionCounter;
    private final Counter creditsDeductedCounter;
    private final Counter duplicateDeductionCounter;
    private final Counter lowBalanceCounter;
    private final Counter topUpInitiatedCounter;
    private final Counter creditsPurchasedCounter;
    private final Counter bonusCreditsCounter;
    private final Counter purchasesExpiredCounter;
    private final Counter uncreditedPaymentCounter;
    private final Counter creditsRefundedCounter;
    private final Counter adjustmentCounter;
    private final Counter reconciliationSuccessCounter;
    private final Counter reconciliationDriftCounter;

    public BillingMetricsServiceImpl(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.leadDeductionCounter = Counter.builder("billing.leads.deducted")
                .description("Number of lead deductions written")
                .register(meterRegistry);
        this.creditsDeductedCounter = Counter.builder("billing.credits.deducted")
                .description("Credits debited for delivered leads")
                .register(meterRegistry);
        this.duplicateDeductionCounter = Counter.builder("billing.leads.duplicate")
                .description("Lead deductions absorbed as duplicates")
                .register(meterRegistry);
        this.lowBalanceCounter = Counter.builder("billing.balance.low")
                .description("Deductions that left a clinic below the low-balance threshold")
                .register(meterRegistry);
        this.topUpInitiatedCounter = Counter.builder("billing.topups.initiated")
                .description("Top-up orders created with the payment processor")
                .register(meterRegistry);
        this.creditsPurchasedCounter = Counter.builder("billing.credits.purchased")
                .description("Credits granted by verified purchases")
                .register(meterRegistry);
        this.bonusCreditsCounter = Counter.builder("billing.credits.bonus")
                .description("Promo bonus credits granted")
                .register(meterRegistry);
        this.purchasesExpiredCounter = Counter.builder("billing.purchases.expired")
                .description("Pending purchases failed by the sweeper")
                .register(meterRegistry);
        this.uncreditedPaymentCounter = Counter.builder("billing.payments.uncredited")
                .description("Verified payments received for purchases that had already failed")
                .register(meterRegistry);
        this.creditsRefundedCounter = Counter.builder("billing.credits.refunded")
                .description("Credits refunded through approved disputes")
                .register(meterRegistry);
        this.adjustmentCounter = Counter.builder("billing.adjustments")
                .description("Manual balance adjustments")
                .register(meterRegistry);
        this.reconciliationSuccessCounter = Counter.builder("billing.reconciliation.success")
                .description("Accounts whose cached balance matched the ledger")
                .register(meterRegistry);
        this.reconciliationDriftCounter = Counter.builder("billing.reconciliation.drift")
                .description("Accounts whose cached balance drifted from the ledger")
                .register(meterRegistry);
    }

    @Override
    public void recordLeadDeduction(Long clinicId, long credits) {
        leadDeductionCounter.increment();
        creditsDeductedCounter.increment(credits);
        log.debug("Recorded lead deduction: clinicId={}, credits={}", clinicId, credits);
    }

    @Override
    public void recordDuplicateDeduction(Long clinicId) {
        duplicateDeductionCounter.increment();
        log.debug("Recorded duplicate deduction: clinicId={}", clinicId);
    }

    @Override
    public void recordLowBalance(Long clinicId, long balance) {
        lowBalanceCounter.increment();
        log.debug("Recorded low balance: clinicId={}, balance={}", clinicId, balance);
    }

    @Override
    public void recordTopUpInitiated(Long clinicId, long credits) {
        topUpInitiatedCounter.increment();
        log.debug("Recorded top-up initiation: clinicId={}, credits={}", clinicId, credits);
    }

    @Override
    public void recordTopUpCredited(Long clinicId, long credits, long bonusCredits) {
        creditsPurchasedCounter.increment(credits);
        bonusCreditsCounter.increment(bonusCredits);
        log.debug("Recorded top-up credit: clinicId={}, credits={}, bonus={}", clinicId, credits, bonusCredits);
    }

    @Override
    public void recordSignatureMismatch(String channel) {
        Counter.builder("billing.signature.mismatch")
                .description("Payment confirmations rejected for a bad signature")
                .tag("channel", channel)
                .register(meterRegistry)
                .increment();
    }

    @Override
    public void recordPaymentForFailedPurchase(Long clinicId) {
        uncreditedPaymentCounter.increment();
        log.debug("Recorded uncredited payment: clinicId={}", clinicId);
    }

    @Override
    public void recordPurchasesExpired(int count) {
        purchasesExpiredCounter.increment(count);
    }

    @Override
    public void recordRefund(Long clinicId, long credits) {
        creditsRefundedCounter.increment(credits);
        log.debug("Recorded refund: clinicId={}, credits={}", clinicId, credits);
    }

    @Override
    public void recordAdjustment(Long clinicId, long amount) {
        adjustmentCounter.increment();
        log.debug("Recorded adjustment: clinicId={}, amount={}", clinicId, amount);
    }

    @Override
    public void recordPromoRejected(String reason) {
        Counter.builder("billing.promo.rejected")
                .description("Promo code applications rejected")
                .tag("reason", reason)
                .register(meterRegistry)
                .increment();
    }

    @Override
    public void recordWebhook(String eventType, String result) {
        Counter.builder("billing.webhooks")
                .description("Payment processor webhooks handled")
                .tag("event", eventType != null ? eventType : "unknown")
                .tag("result", result)
                .register(meterRegistry)
                .increment();
    }

    @Override
    public void recordReconciliationSuccess(Long clinicId) {
        reconciliationSuccessCounter.increment();
    }

    @Override
    public void recordReconciliationDrift(Long clinicId, long driftAmount) {
        reconciliationDriftCounter.increment();
        log.debug("Recorded reconciliation drift: clinicId={}, drift={}", clinicId, driftAmount);
    }
}
