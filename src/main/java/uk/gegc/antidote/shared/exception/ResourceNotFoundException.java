package uk.gegc.antidote.shared.exception;

public class ResourceNotFoundException extends BillingException {

    public ResourceNotFoundException(String message) {
        super(message);
    }

    @Override
    public BillingErrorKind getKind() {
        return BillingErrorKind.NOT_FOUND;
    }
}
