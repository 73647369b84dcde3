package uk.gegc.antidote.features.payment.domain.exception;

import uk.gegc.antidote.shared.exception.BillingErrorKind;
import uk.gegc.antidote.shared.exception.BillingException;

public class PaymentGatewayException extends BillingException {

    public PaymentGatewayException(String message) {
        super(message);
    }

    public PaymentGatewayException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public BillingErrorKind getKind() {
        return BillingErrorKind.GATEWAY_UNAVAILABLE;
    }
}
