package uk.gegc.antidote.features.promo.domain.exception;

/**
 * Why a promo code cannot be applied, in the order the checks run.
 */
public enum PromoRejectionReason {
    NOT_FOUND,
    INACTIVE,
    NOT_YET_VALID,
    EXPIRED,
    BELOW_MINIMUM,
    EXHAUSTED,
    ALREADY_REDEEMED,
    DISCOUNT_EXCEEDS_AMOUNT
}
