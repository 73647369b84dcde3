package uk.gegc.antidote.features.dispute.domain.exception;

import uk.gegc.antidote.shared.exception.BillingErrorKind;
import uk.gegc.antidote.shared.exception.BillingException;

import java.util.UUID;

public class DisputeAlreadyResolvedException extends BillingException {

    private final UUID disputeId;

    public DisputeAlreadyResolvedException(String message, UUID disputeId) {
        super(message);
        this.disputeId = disputeId;
    }

    public UUID getDisputeId() {
        return disputeId;
    }

    @Override
    public BillingErrorKind getKind() {
        return BillingErrorKind.DISPUTE_ALREADY_RESOLVED;
    }
}
