package uk.gegc.antidote.shared.exception;

/**
 * Base class of all domain errors raised by the billing features.
 */
public abstract class BillingException extends RuntimeException {

    protected BillingException(String message) {
        super(message);
    }

    protected BillingException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract BillingErrorKind getKind();
}
