package uk.gegc.antidote.features.ledger.domain.exception;

import uk.gegc.antidote.shared.exception.BillingErrorKind;
import uk.gegc.antidote.shared.exception.BillingException;

/**
 * Raised when a ledger write collides with an existing entry, either through its idempotency key or
 * because the target entry was already settled differently.
 */
public class DuplicateLedgerEntryException extends BillingException {

    private final String idempotencyKey;

    public DuplicateLedgerEntryException(String message, String idempotencyKey) {
        super(message);
        this.idempotencyKey = idempotencyKey;
    }

    public DuplicateLedgerEntryException(String message, String idempotencyKey, Throwable cause) {
        super(message, cause);
        this.idempotencyKey = idempotencyKey;
    }

    public String getIdempotencyKey() {
        return idempotencyKey;
    }

    @Override
    public BillingErrorKind getKind() {
        return BillingErrorKind.CONSTRAINT_VIOLATION;
    }
}
