package uk.gegc.antidote.features.billing.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

/**
 * @param duplicate true when the idempotency key had already been applied; the original entries are returned
 */
@Schema(name = "TransferResult")
public record TransferResult(
        TransactionDto debit,
        TransactionDto credit,
        boolean duplicate
) {
}
