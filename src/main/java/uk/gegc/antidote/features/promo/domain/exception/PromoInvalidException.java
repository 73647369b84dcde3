package uk.gegc.antidote.features.promo.domain.exception;

import uk.gegc.antidote.shared.exception.BillingErrorKind;
import uk.gegc.antidote.shared.exception.BillingException;

public class PromoInvalidException extends BillingException {

    private final String code;
    private final PromoRejectionReason reason;

    public PromoInvalidException(String code, PromoRejectionReason reason, String message) {
        super(message);
        this.code = code;
        this.reason = reason;
    }

    public String getCode() {
        return code;
    }

    public PromoRejectionReason getReason() {
        return reason;
    }

    @Override
    public BillingErrorKind getKind() {
        return BillingErrorKind.PROMO_INVALID;
    }
}
