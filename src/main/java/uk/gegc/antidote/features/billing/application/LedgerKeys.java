package uk.gegc.antidote.features.billing.application;

import java.util.UUID;

/**
 * Idempotency keys of billing-authored ledger entries.
 */
public final class LedgerKeys {

    private LedgerKeys() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    public static String leadDeduction(Long clinicId, Long leadId) {
        return "lead:" + clinicId + ":" + leadId;
    }

    public static String purchase(String orderId) {
        return "order:" + orderId;
    }

    public static String promoBonus(String orderId) {
        return "order:" + orderId + ":bonus";
    }

    public static String disputeRefund(UUID disputeId) {
        return "dispute:" + disputeId + ":refund";
    }

    public static String adjustment(String clientKey) {
        return "adjust:" + clientKey;
    }

    public static String transferOut(String clientKey) {
        return "transfer:" + clientKey + ":out";
    }

    public static String transferIn(String clientKey) {
        return "transfer:" + clientKey + ":in";
    }
}
