package uk.gegc.antidote.shared.metrics;

/**
 * Counters for billing activity.
 */
public interface BillingMetricsService {

    void recordLeadDeduction(Long clinicId, long credits);

    void recordDuplicateDeduction(Long clinicId);

    void recordLowBalance(Long clinicId, long balance);

    void recordTopUpInitiated(Long clinicId, long credits);

    void recordTopUpCredited(Long clinicId, long credits, long bonusCredits);

    void recordSignatureMismatch(String channel);

    /**
     * A verified payment arrived for a purchase that had already failed: money was taken but not credited.
     */
    void recordPaymentForFailedPurchase(Long clinicId);

    void recordPurchasesExpired(int count);

    void recordRefund(Long clinicId, long credits);

    void recordAdjustment(Long clinicId, long amount);

    void recordPromoRejected(String reason);

    void recordWebhook(String eventType, String result);

    void recordReconciliationSuccess(Long clinicId);

    void recordReconciliationDrift(Long clinicId, long driftAmount);
}
