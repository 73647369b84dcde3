package uk.gegc.antidote.shared.exception;

public class InvalidInputException extends BillingException {

    public InvalidInputException(String message) {
        super(message);
    }

    @Override
    public BillingErrorKind getKind() {
        return BillingErrorKind.INVALID_INPUT;
    }
}
