package uk.gegc.antidote.features.billing.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.antidote.features.ledger.domain.model.CreditTransactionKind;
import uk.gegc.antidote.features.ledger.domain.model.CreditTransactionStatus;

import java.time.LocalDateTime;
import java.util.UUID;

@Schema(name = "CreditTransaction", description = "A ledger entry")
public record TransactionDto(
        UUID id,
        Long clinicId,
        @Schema(description = "Positive for credits, negative for debits", example = "-180")
        long amount,
        CreditTransactionKind kind,
        CreditTransactionStatus status,
        Long leadId,
        String externalOrderId,
        String externalPaymentId,
        String refId,
        String description,
        Long balanceAfter,
        LocalDateTime createdAt
) {
}
