package uk.gegc.antidote.features.promo.domain.model;

public enum PromoDiscountType {
    PERCENTAGE,
    FIXED
}
