package uk.gegc.antidote.features.promo.domain.model;

/**
 * {@code RESERVED} while the purchase is pending. {@code RESERVED} and {@code REDEEMED} usages count
 * toward usage limits; {@code RELEASED} ones do not.
 */
public enum PromoUsageStatus {
    RESERVED,
    REDEEMED,
    RELEASED
}
