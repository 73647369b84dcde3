package uk.gegc.antidote.features.billing.api.dto;

public enum TopUpOutcome {
    CREDITED,
    /** The purchase had already failed; nothing was credited. */
    PAYMENT_NOT_VERIFIED
}
