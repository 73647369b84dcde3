package uk.gegc.antidote.features.ledger.application;

import org.slf4j.Logger;
import org.slf4j.MDC;
import uk.gegc.antidote.features.ledger.domain.model.CreditTransaction;

/**
 * Structured logging for ledger writes. Populates the {@code billing.*} MDC keys for the duration of
 * a single log call.
 */
public final class LedgerStructuredLogger {

    private LedgerStructuredLogger() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    public static void logLedgerWrite(Logger logger, String message, CreditTransaction tx, Object... args) {
        MDC.put("billing.clinicId", String.valueOf(tx.getClinicId()));
        MDC.put("billing.kind", tx.getKind() != null ? tx.getKind().name() : null);
        MDC.put("billing.amount", String.valueOf(tx.getAmount()));
        MDC.put("billing.idempotencyKey", tx.getIdempotencyKey());
        MDC.put("billing.balanceAfter", tx.getBalanceAfter() != null ? tx.getBalanceAfter().toString() : null);
        MDC.put("billing.refId", tx.getRefId());
        try {
            logger.info(message, args);
        } finally {
            clearBillingMDC();
        }
    }

    public static void clearBillingMDC() {
        MDC.remove("billing.clinicId");
        MDC.remove("billing.kind");
        MDC.remove("billing.amount");
        MDC.remove("billing.idempotencyKey");
        MDC.remove("billing.balanceAfter");
        MDC.remove("billing.refId");
    }
}
