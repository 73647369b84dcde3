package uk.gegc.antidote.shared.exception;

public class DuplicateResourceException extends BillingException {

    public DuplicateResourceException(String message) {
        super(message);
    }

    @Override
    public BillingErrorKind getKind() {
        return BillingErrorKind.CONSTRAINT_VIOLATION;
    }
}
