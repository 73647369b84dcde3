package uk.gegc.antidote.shared.exception;

import org.springframework.http.HttpStatus;

/**
 * Error taxonomy shared by every billing operation, with the HTTP status each kind maps to.
 */
public enum BillingErrorKind {
    INVALID_INPUT(HttpStatus.BAD_REQUEST),
    NOT_FOUND(HttpStatus.NOT_FOUND),
    /** Safe for callers to treat as "already handled". */
    CONSTRAINT_VIOLATION(HttpStatus.CONFLICT),
    SIGNATURE_MISMATCH(HttpStatus.BAD_REQUEST),
    INSUFFICIENT_PRIVILEGE(HttpStatus.FORBIDDEN),
    DUPLICATE_DISPUTE(HttpStatus.CONFLICT),
    DISPUTE_ALREADY_RESOLVED(HttpStatus.CONFLICT),
    PROMO_INVALID(HttpStatus.UNPROCESSABLE_ENTITY),
    /** Retry later. */
    GATEWAY_UNAVAILABLE(HttpStatus.BAD_GATEWAY);

    private final HttpStatus status;

    BillingErrorKind(HttpStatus status) {
        this.status = status;
    }

    public HttpStatus getStatus() {
        return status;
    }
}
