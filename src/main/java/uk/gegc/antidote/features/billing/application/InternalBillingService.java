package uk.gegc.antidote.features.billing.application;

import uk.gegc.antidote.features.billing.api.dto.TopUpConfirmation;
import uk.gegc.antidote.features.billing.api.dto.TransactionDto;

import java.util.Optional;
import java.util.UUID;

/**
 * Ledger writes on behalf of trusted collaborators (processor webhooks, the dispute workflow).
 * Not exposed to controllers.
 */
public interface InternalBillingService {

    /**
     * Completes the purchase behind an already-verified processor payment.
     *
     * @return empty when no purchase exists for the order
     */
    Optional<TopUpConfirmation> completeVerifiedPayment(String orderId, String paymentId);

    /**
     * @return true if a pending purchase was failed by this call
     */
    boolean failPendingPurchase(String orderId, String reason);

    /**
     * Credits a refund for an approved dispute. Keyed on the dispute, so a repeat returns the existing entry.
     */
    TransactionDto creditRefund(Long clinicId, Long leadId, long amount, UUID disputeId, String reason);
}
