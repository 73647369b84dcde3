package uk.gegc.antidote.shared.exception;

public class InsufficientPrivilegeException extends BillingException {

    public InsufficientPrivilegeException(String message) {
        super(message);
    }

    @Override
    public BillingErrorKind getKind() {
        return BillingErrorKind.INSUFFICIENT_PRIVILEGE;
    }
}
