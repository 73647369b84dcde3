package uk.gegc.antidote.features.payment.domain.exception;

import uk.gegc.antidote.shared.exception.BillingErrorKind;
import uk.gegc.antidote.shared.exception.BillingException;

public class SignatureMismatchException extends BillingException {

    public SignatureMismatchException(String message) {
        super(message);
    }

    @Override
    public BillingErrorKind getKind() {
        return BillingErrorKind.SIGNATURE_MISMATCH;
    }
}
