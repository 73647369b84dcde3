package uk.gegc.antidote.features.billing.api.dto;

import java.util.UUID;

public record TopUpConfirmation(
        UUID transactionId,
        Long clinicId,
        String orderId,
        String paymentId,
        TopUpOutcome outcome,
        long creditedAmount,
        long bonusCredits,
        long newBalance,
        boolean duplicate
) {
}
