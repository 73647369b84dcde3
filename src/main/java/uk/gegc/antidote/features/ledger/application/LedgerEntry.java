package uk.gegc.antidote.features.ledger.application;

import lombok.Builder;
import uk.gegc.antidote.features.ledger.domain.model.CreditTransactionKind;
import uk.gegc.antidote.features.ledger.domain.model.CreditTransactionStatus;

/**
 * A ledger entry to be appended. Only {@code PENDING} and {@code COMPLETED} entries can be appended.
 */
@Builder
public record LedgerEntry(
        Long clinicId,
        long amount,
        CreditTransactionKind kind,
        CreditTransactionStatus status,
        String idempotencyKey,
        Long leadId,
        String externalOrderId,
        String externalPaymentId,
        String refId,
        String description,
        String metaJson
) {
}
